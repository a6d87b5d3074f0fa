package com.example.purgebot.controller;

import com.example.purgebot.model.RunStatus;
import com.example.purgebot.model.StatsSnapshot;
import com.example.purgebot.service.StatsAggregator;
import com.example.purgebot.service.StatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 运行统计与实时状态接口。
 */
@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatsController {

    private final StatsAggregator statsAggregator;
    private final StatusService statusService;

    @GetMapping
    public ResponseEntity<StatsSnapshot> stats() {
        return ResponseEntity.ok(statsAggregator.snapshot());
    }

    @GetMapping("/status")
    public ResponseEntity<RunStatus> status() {
        return ResponseEntity.ok(statusService.currentStatus());
    }

    /**
     * 最近的运行历史，最新的在前
     */
    @GetMapping("/history")
    public ResponseEntity<List<StatsSnapshot.HistoryEntry>> history(
            @RequestParam(defaultValue = "90") int limit) {
        return ResponseEntity.ok(statsAggregator.history(limit));
    }
}
