package com.kotsin.grid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "grid.signal")
public record SignalProps(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("20") int emaShort,
        @DefaultValue("50") int emaMedium,
        @DefaultValue("200") int emaLong,
        @DefaultValue("14") int adxPeriod,
        @DefaultValue("25") double adxThreshold,
        @DefaultValue("1h") String timeframe,
        @DefaultValue("300") int limit,
        @DefaultValue("3600s") Duration refreshInterval
) {
}
