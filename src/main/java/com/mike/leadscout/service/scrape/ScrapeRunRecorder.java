package com.mike.leadscout.service.scrape;

import com.mike.leadscout.dto.ResolvedConfig;
import com.mike.leadscout.dto.ScrapeCycleResult;
import com.mike.leadscout.entity.Channel;
import com.mike.leadscout.entity.RunOutcome;
import com.mike.leadscout.entity.ScrapeRun;
import com.mike.leadscout.repository.ScrapeRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Operational log of scheduler ticks. Each run is written when it starts and again when it
 * ends, and is always emitted as a log line, so a database outage loses no run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScrapeRunRecorder {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ScrapeRunRepository repository;
    private final Clock clock;

    public ScrapeRun start(Channel channel) {
        ScrapeRun run = ScrapeRun.builder()
                .channelId(channel.getId())
                .platformConnectionId(channel.getPlatformConnectionId())
                .startedAt(LocalDateTime.now(clock))
                .build();
        log.info("ScrapeRun: started channelId={} startedAt={}", run.getChannelId(), run.getStartedAt());
        return persist(run);
    }

    public ScrapeRun finishSuccess(ScrapeRun run, ResolvedConfig config, ScrapeCycleResult result, int attempts) {
        run.setOutcome(RunOutcome.SUCCESS);
        run.setErrorDetail(null);
        run.setPostsFound(result.getPostsFound());
        run.setLeadsCreated(result.getLeadsCreated());
        run.setAttempts(attempts);
        applyConfig(run, config);
        return finish(run);
    }

    public ScrapeRun finishFailure(ScrapeRun run, ResolvedConfig config, String errorDetail, int attempts) {
        run.setOutcome(RunOutcome.FAILURE);
        run.setErrorDetail(truncate(errorDetail));
        run.setAttempts(attempts);
        applyConfig(run, config);
        return finish(run);
    }

    public List<ScrapeRun> recentRuns(Long channelId, int limit) {
        int size = Math.max(1, limit);
        if (channelId == null) {
            return repository.findAll(PageRequest.of(0, size, Sort.by(Sort.Direction.DESC, "startedAt"))).getContent();
        }
        return repository.findByChannelIdOrderByStartedAtDesc(channelId, PageRequest.of(0, size));
    }

    private ScrapeRun finish(ScrapeRun run) {
        LocalDateTime endedAt = LocalDateTime.now(clock);
        // keeps startedAt <= endedAt even if the clock stepped back
        run.setEndedAt(endedAt.isBefore(run.getStartedAt()) ? run.getStartedAt() : endedAt);

        log.info("ScrapeRun: channelId={} outcome={} startedAt={} endedAt={} attempts={} postsFound={} leadsCreated={} configVersion={} configSource={} errorDetail={}",
                run.getChannelId(), run.getOutcome(), run.getStartedAt(), run.getEndedAt(), run.getAttempts(),
                run.getPostsFound(), run.getLeadsCreated(), run.getConfigVersion(), run.getConfigSource(),
                run.getErrorDetail());
        return persist(run);
    }

    private ScrapeRun persist(ScrapeRun run) {
        try {
            return repository.save(run);
        } catch (DataAccessException e) {
            log.error("ScrapeRun: could not persist run channelId={} outcome={}", run.getChannelId(), run.getOutcome(), e);
            return run;
        }
    }

    private static void applyConfig(ScrapeRun run, ResolvedConfig config) {
        if (config == null) return;
        run.setConfigVersion(config.config().version());
        run.setConfigSource(config.source().wireName());
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) return value;
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
