package com.kotsin.grid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "grid")
public record GridProps(
        @DefaultValue("XRPUSDC") String symbol,
        @DefaultValue("3") double baseQuantity,
        @DefaultValue("0.001") double gridSpacing,
        @DefaultValue("500") double positionThreshold, // conservative mode above this
        @DefaultValue("200") double positionLimit,     // double take-profit size above this
        @DefaultValue("15") int leverage,
        @DefaultValue("10s") Duration orderFirstTime,  // min gap between two entry orders on one side
        @DefaultValue("1s") Duration tickThrottle,
        @DefaultValue("30s") Duration positionSyncInterval,
        @DefaultValue("60s") Duration orderSyncInterval,
        @DefaultValue("300s") Duration barPollInterval,
        @DefaultValue("0.10") double maxPriceJump,
        @DefaultValue("10") int maxConsecutiveRejects
) {
}
