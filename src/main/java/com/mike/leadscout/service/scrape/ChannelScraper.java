package com.mike.leadscout.service.scrape;

import com.mike.leadscout.dto.ScrapedPost;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Channel;

import java.util.List;

public interface ChannelScraper {

    /**
     * @throws ScrapeExecutionException on any browser-side failure
     */
    List<ScrapedPost> scrape(Channel channel, ScraperConfig config);
}
