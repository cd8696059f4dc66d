package com.kotsin.grid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "grid.protection")
public record ProtectionProps(
        @DefaultValue("11.0") double extremeThreshold,   // cumulative run move, percent
        @DefaultValue("24") double hibernationHours,
        @DefaultValue("1.5") double recoveryMultiplier,
        @DefaultValue("30s") Duration emergencyCloseTimeout,
        @DefaultValue("1s") Duration fillPollInterval,
        @DefaultValue("60s") Duration emergencyRetry,
        @DefaultValue("14") int volatilityPeriod,
        @DefaultValue("20") int baselineSamples,
        @DefaultValue("redis") String store,
        @DefaultValue("data/protection_state.json") String stateFile,
        @DefaultValue("300s") Duration watchdogInterval,
        @DefaultValue("1h") String barTimeframe
) {
}
