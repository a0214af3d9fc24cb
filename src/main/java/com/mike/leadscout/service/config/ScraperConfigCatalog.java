package com.mike.leadscout.service.config;

import com.mike.leadscout.config.ConfigServiceProperties;
import com.mike.leadscout.dto.ScraperConfigDocument;
import com.mike.leadscout.entity.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Config documents served by this instance, one per platform, taken from
 * {@code leadscout.config-service.platforms}.
 */
@Component
@Slf4j
public class ScraperConfigCatalog {

    private final Map<Platform, ScraperConfigDocument.ConfigBody> documents = new EnumMap<>(Platform.class);
    private final Clock clock;

    public ScraperConfigCatalog(ConfigServiceProperties props, Clock clock) {
        this.clock = clock;
        props.platforms().forEach((name, body) -> {
            Optional<Platform> platform = Platform.fromName(name);
            if (platform.isEmpty()) {
                log.warn("ScraperConfigCatalog: ignoring config for unknown platform '{}'", name);
                return;
            }
            // reject documents the client would refuse anyway
            ScraperConfigClient.toScraperConfig(platform.get(), body);
            documents.put(platform.get(), body);
        });
        log.info("ScraperConfigCatalog: serving configs for {}", documents.keySet());
    }

    public Optional<ScraperConfigDocument> find(String platformName) {
        return Platform.fromName(platformName)
                .filter(documents::containsKey)
                .map(p -> new ScraperConfigDocument(p.name(), documents.get(p), Instant.now(clock).toString()));
    }

    public List<String> supportedPlatforms() {
        return documents.keySet().stream().map(Enum::name).toList();
    }
}
