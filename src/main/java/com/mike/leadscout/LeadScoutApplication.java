package com.mike.leadscout;

import com.mike.leadscout.config.ConfigServiceProperties;
import com.mike.leadscout.config.LeadScoutProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties({LeadScoutProperties.class, ConfigServiceProperties.class})
public class LeadScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadScoutApplication.class, args);
    }

}
