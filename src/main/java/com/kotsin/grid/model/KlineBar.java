package com.kotsin.grid.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One closed OHLCV bar. Direction is derived from the body: anything within
 * +/-0.1% of the open is noise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KlineBar {

    public static final double NOISE_THRESHOLD_PERCENT = 0.1;

    private Instant timestamp; // bar open time
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;
    private double changePercent;
    private BarDirection direction;

    public static KlineBar of(Instant timestamp, double open, double high, double low, double close, double volume) {
        double change = open > 0 ? (close - open) / open * 100.0 : 0.0;
        return KlineBar.builder()
                .timestamp(timestamp)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .changePercent(change)
                .direction(directionOf(change))
                .build();
    }

    public static BarDirection directionOf(double changePercent) {
        if (changePercent > NOISE_THRESHOLD_PERCENT) return BarDirection.UP;
        if (changePercent < -NOISE_THRESHOLD_PERCENT) return BarDirection.DOWN;
        return BarDirection.NEUTRAL;
    }
}
