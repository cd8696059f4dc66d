package com.kotsin.grid.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties({GridProps.class, ProtectionProps.class, SignalProps.class, BinanceProps.class})
public class AppConfig {

    /**
     * Order events already applied, keyed by orderId:status:filledQty.
     * The user stream redelivers after reconnects.
     */
    @Bean
    public Cache<String, Boolean> processedOrderEventsCache(
            @Value("${grid.idempotency.max-entries:50000}") long maxEntries) {
        return Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(Duration.ofHours(6))
                .build();
    }

    @Bean
    public OkHttpClient exchangeHttpClient() {
        return new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(15))
                .pingInterval(Duration.ofSeconds(20))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fan-out pool for the emergency cancel/flatten sequence. Two sides plus a
     * burst of cancels is the worst case.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService emergencyExecutor(
            @Value("${grid.protection.emergency-threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "grid-emergency");
            t.setDaemon(true);
            return t;
        });
    }
}
