package com.kotsin.grid.signal;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One classification with the indicator values behind it.
 */
@Value
@Builder
public class SignalSnapshot {
    TrendSignal signal;
    double close;
    double emaShort;
    double emaMedium;
    double emaLong;
    double adx;
    double plusDi;
    double minusDi;
    double confidence; // 0..100, zero when ranging
    Instant evaluatedAt;
}
