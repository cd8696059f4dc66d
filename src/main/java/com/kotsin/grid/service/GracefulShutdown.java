package com.kotsin.grid.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops every {@link StoppableStrategy} once. Positions and orders are left
 * as they are; account cleanup is an operator task.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GracefulShutdown {

    private final List<StoppableStrategy> strategies;
    private final AtomicBoolean started = new AtomicBoolean(false);

    @PreDestroy
    public void shutdown() {
        if (!started.compareAndSet(false, true)) {
            log.warn("SHUTDOWN_ALREADY_IN_PROGRESS");
            return;
        }
        log.info("SHUTDOWN_START strategies={}", strategies.size());
        for (StoppableStrategy s : strategies) {
            try {
                s.stop();
                log.info("SHUTDOWN_STOPPED {}", s.name());
            } catch (Exception e) {
                log.error("SHUTDOWN_STOP_FAILED {} error={}", s.name(), e.getMessage());
            }
        }
    }

    public boolean isShuttingDown() {
        return started.get();
    }
}
