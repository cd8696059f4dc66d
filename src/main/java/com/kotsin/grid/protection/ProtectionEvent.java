package com.kotsin.grid.protection;

import com.kotsin.grid.model.BarDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProtectionEvent {

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    private String eventId;
    private String symbol;
    private ProtectionEventType eventType;
    private Severity severity;
    private String message;

    private BarDirection direction;
    private int barCount;
    private double cumulativeMovePercent;
    private double price;
    private Double baselineVolatility;
    private double currentVolatility;

    private Instant timestamp;

    private static ProtectionEventBuilder base(String symbol, ProtectionEventType type, Severity severity,
                                               ProtectionState s, Instant at) {
        return ProtectionEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .symbol(symbol)
                .eventType(type)
                .severity(severity)
                .direction(s.getDirection())
                .barCount(s.getBarCount())
                .cumulativeMovePercent(s.getCumulativeMovePercent())
                .baselineVolatility(s.getBaselineVolatility())
                .timestamp(at);
    }

    public static ProtectionEvent runStarted(String symbol, ProtectionState s, Instant at) {
        return base(symbol, ProtectionEventType.RUN_STARTED, Severity.INFO, s, at)
                .message("New " + s.getDirection() + " run from " + s.getRunStartPrice())
                .build();
    }

    public static ProtectionEvent runEnded(String symbol, ProtectionState s, Instant at) {
        return base(symbol, ProtectionEventType.RUN_ENDED, Severity.INFO, s, at)
                .message("Neutral bar, run reset")
                .build();
    }

    public static ProtectionEvent triggered(String symbol, ProtectionState run, double price, Instant at) {
        return base(symbol, ProtectionEventType.TRIGGERED, Severity.CRITICAL, run, at)
                .price(price)
                .message(String.format("Extreme %s move %.2f%% over %d bars, flattened and hibernating",
                        run.getDirection(), run.getCumulativeMovePercent(), run.getBarCount()))
                .build();
    }

    public static ProtectionEvent triggerFailed(String symbol, ProtectionState run, double price,
                                                boolean cancelled, boolean flattened, Instant at) {
        return base(symbol, ProtectionEventType.TRIGGER_FAILED, Severity.CRITICAL, run, at)
                .price(price)
                .message("Emergency sequence incomplete: ordersCancelled=" + cancelled + " positionsClosed=" + flattened)
                .build();
    }

    public static ProtectionEvent resumed(String symbol, ProtectionState s, double currentVolatility, Instant at) {
        return base(symbol, ProtectionEventType.RESUMED, Severity.WARNING, s, at)
                .currentVolatility(currentVolatility)
                .message(String.format("Hibernation ended, volatility %.6f back under baseline x multiplier", currentVolatility))
                .build();
    }

    public static ProtectionEvent forceReset(String symbol, ProtectionState s, Instant at) {
        return base(symbol, ProtectionEventType.FORCE_RESET, Severity.WARNING, s, at)
                .message("Protection state reset by operator")
                .build();
    }
}
