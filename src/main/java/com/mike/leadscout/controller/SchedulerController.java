package com.mike.leadscout.controller;

import com.mike.leadscout.dto.ChannelScheduleState;
import com.mike.leadscout.entity.ScrapeRun;
import com.mike.leadscout.scheduler.ScrapeScheduler;
import com.mike.leadscout.service.scrape.PlatformConnectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final ScrapeScheduler scrapeScheduler;
    private final PlatformConnectionService connectionService;

    @PostMapping("/channels/{channelId}/start")
    public ResponseEntity<ChannelScheduleState> start(
            @PathVariable Long channelId,
            @RequestParam(required = false) Long intervalMs
    ) {
        try {
            scrapeScheduler.startSchedule(channelId, intervalMs);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return ResponseEntity.ok(scrapeScheduler.state(channelId));
    }

    @PostMapping("/channels/{channelId}/stop")
    public ChannelScheduleState stop(@PathVariable Long channelId) {
        scrapeScheduler.stopSchedule(channelId);
        return scrapeScheduler.state(channelId);
    }

    @PostMapping("/channels/{channelId}/run")
    public ResponseEntity<?> runNow(@PathVariable Long channelId) {
        if (scrapeScheduler.state(channelId).running()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "ALREADY_RUNNING"));
        }
        Optional<ScrapeRun> run;
        try {
            run = scrapeScheduler.runNow(channelId);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return run
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "SKIPPED")));
    }

    @GetMapping("/channels/{channelId}")
    public ChannelScheduleState state(@PathVariable Long channelId) {
        return scrapeScheduler.state(channelId);
    }

    @PostMapping("/connections/{connectionId}/disconnect")
    public Map<String, Object> disconnect(@PathVariable Long connectionId) {
        connectionService.disconnect(connectionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown platform connection " + connectionId));
        int stopped = scrapeScheduler.stopPlatformConnection(connectionId);
        return Map.of("connectionId", connectionId, "channelsStopped", stopped);
    }
}
