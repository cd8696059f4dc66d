package com.kotsin.grid.protection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.grid.model.BarDirection;
import com.kotsin.grid.model.KlineBar;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable protection state: the current directional run, the volatility
 * baseline and the hibernation flag.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProtectionState {

    @Builder.Default
    private BarDirection direction = BarDirection.NEUTRAL;
    private int barCount;
    private double cumulativeMovePercent;
    private Double runStartPrice;
    private Instant runStartTime;

    private Double baselineVolatility;

    private boolean protectionActive;
    private Instant hibernationStart;

    private Instant lastBarTime;
    private Instant lastUpdate;

    public enum RunTransition {
        STARTED,
        EXTENDED,
        ENDED,
        UNCHANGED
    }

    public static ProtectionState initial() {
        return ProtectionState.builder().build();
    }

    /**
     * Folds one closed bar into the run.
     */
    public RunTransition applyBar(KlineBar bar) {
        BarDirection d = bar.getDirection();
        if (d == BarDirection.NEUTRAL) {
            boolean hadRun = direction != BarDirection.NEUTRAL;
            resetRun();
            return hadRun ? RunTransition.ENDED : RunTransition.UNCHANGED;
        }
        if (d == direction) {
            barCount++;
            if (runStartPrice != null && runStartPrice > 0) {
                double move = (bar.getClose() - runStartPrice) / runStartPrice * 100.0;
                cumulativeMovePercent = d == BarDirection.DOWN ? Math.abs(move) : move;
            }
            return RunTransition.EXTENDED;
        }
        direction = d;
        barCount = 1;
        runStartPrice = bar.getOpen();
        runStartTime = bar.getTimestamp();
        cumulativeMovePercent = Math.abs(bar.getChangePercent());
        return RunTransition.STARTED;
    }

    public void resetRun() {
        direction = BarDirection.NEUTRAL;
        barCount = 0;
        cumulativeMovePercent = 0.0;
        runStartPrice = null;
        runStartTime = null;
    }

    /**
     * Repairs a loaded record: an active flag without a start time cannot be
     * timed out, so it restarts hibernation now.
     */
    public void normalize(Instant now) {
        if (direction == null) direction = BarDirection.NEUTRAL;
        if (protectionActive && hibernationStart == null) hibernationStart = now;
        if (!protectionActive) hibernationStart = null;
    }

    public ProtectionState copy() {
        return toBuilder().build();
    }
}
