package com.kotsin.grid.controller;

import com.kotsin.grid.engine.GridEngine;
import com.kotsin.grid.engine.GridSnapshot;
import com.kotsin.grid.model.TradeRecord;
import com.kotsin.grid.service.TradeRecordService;
import com.kotsin.grid.signal.SignalSnapshot;
import com.kotsin.grid.signal.TrendSignalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/grid")
@RequiredArgsConstructor
@Tag(name = "Grid", description = "Grid engine state and trade records")
public class GridStatusController {

    private final GridEngine gridEngine;
    private final TrendSignalService trendSignalService;
    private final TradeRecordService tradeRecordService;

    @GetMapping("/status")
    @Operation(summary = "Positions, resting order counters, spacing and trend signal")
    public ResponseEntity<Map<String, Object>> getStatus() {
        GridSnapshot grid = gridEngine.snapshot();
        SignalSnapshot signal = trendSignalService.current();
        Map<String, Object> body = new HashMap<>();
        body.put("grid", grid);
        body.put("signal", signal == null ? "UNAVAILABLE" : signal);
        body.put("signalLastRefresh", trendSignalService.lastRefresh());
        return ResponseEntity.ok(body);
    }

    /**
     * Undo compounded signal adjustments.
     */
    @PostMapping("/spacing/reset")
    @Operation(summary = "Restore configured base spacing on both legs")
    public ResponseEntity<Map<String, Object>> resetSpacing() {
        gridEngine.resetSpacing();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Grid spacing reset to base"
        ));
    }

    @GetMapping("/trades")
    @Operation(summary = "Fills recorded within the last N hours")
    public ResponseEntity<List<TradeRecord>> getRecentTrades(@RequestParam(defaultValue = "1") int hours) {
        return ResponseEntity.ok(tradeRecordService.recentTrades(Duration.ofHours(Math.max(1, hours))));
    }
}
