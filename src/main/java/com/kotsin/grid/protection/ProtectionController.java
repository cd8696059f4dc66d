package com.kotsin.grid.protection;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for extreme-market protection.
 */
@RestController
@RequestMapping("/api/protection")
@RequiredArgsConstructor
@Tag(name = "Protection", description = "Extreme-market protection state and operator override")
public class ProtectionController {

    private final ExtremeProtectionService protectionService;

    @GetMapping("/status")
    @Operation(summary = "Current run, volatility and hibernation state")
    public ResponseEntity<ProtectionStatus> getStatus() {
        return ResponseEntity.ok(protectionService.status());
    }

    /**
     * Leave hibernation immediately. Positions stay flat until the grid re-enters.
     */
    @PostMapping("/reset")
    @Operation(summary = "Force-clear hibernation and the current run")
    public ResponseEntity<Map<String, Object>> reset() {
        protectionService.forceReset();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Protection reset - grid trading resumes on the next tick"
        ));
    }
}
