package com.kotsin.grid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "binance")
public record BinanceProps(
        String apiKey,
        String apiSecret,
        @DefaultValue("https://fapi.binance.com") String restBaseUrl,
        @DefaultValue("wss://fstream.binance.com") String wsBaseUrl,
        @DefaultValue("5000") long recvWindow,
        @DefaultValue("1800s") Duration listenKeyKeepalive,
        @DefaultValue("60s") Duration keepaliveRetry,
        @DefaultValue("5s") Duration reconnectDelay
) {
}
