package com.mike.leadscout.controller;

import com.mike.leadscout.entity.ScrapeRun;
import com.mike.leadscout.service.scrape.ScrapeRunRecorder;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ScrapeRunController {

    private final ScrapeRunRecorder runRecorder;

    @GetMapping("/api/scrape-runs")
    public List<ScrapeRun> recentRuns(
            @RequestParam(required = false) Long channelId,
            @RequestParam(defaultValue = "20") int limit
    ) {
        return runRecorder.recentRuns(channelId, Math.min(limit, 200));
    }
}
