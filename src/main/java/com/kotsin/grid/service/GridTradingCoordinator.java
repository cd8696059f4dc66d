package com.kotsin.grid.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.grid.broker.GatewayException;
import com.kotsin.grid.broker.MarketEventListener;
import com.kotsin.grid.broker.MarketGateway;
import com.kotsin.grid.broker.MarketStreamClient;
import com.kotsin.grid.config.GridProps;
import com.kotsin.grid.config.ProtectionProps;
import com.kotsin.grid.engine.GridEngine;
import com.kotsin.grid.model.BookTicker;
import com.kotsin.grid.model.KlineBar;
import com.kotsin.grid.model.OrderUpdateEvent;
import com.kotsin.grid.protection.ExtremeProtectionService;
import com.kotsin.grid.protection.ProtectionDecision;
import com.kotsin.grid.signal.TrendSignalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single event path. Stream events arrive here one at a time; price
 * ticks drive protection, periodic reconciliation and the grid cycle.
 */
@Service
@Slf4j
public class GridTradingCoordinator implements MarketEventListener, StoppableStrategy, ApplicationRunner {

    private static final int BAR_POLL_LIMIT = 3;

    private final MarketGateway gateway;
    private final GridEngine engine;
    private final ExtremeProtectionService protection;
    private final TrendSignalService signalService;
    private final PriceValidator priceValidator;
    private final MarketStreamClient streamClient;
    private final Cache<String, Boolean> processedOrderEventsCache;
    private final GridProps props;
    private final ProtectionProps protectionProps;
    private final Clock clock;
    private final TaskScheduler scheduler;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile Instant lastProcessedAt;
    private volatile Instant lastPositionSync;
    private volatile Instant lastOrderSync;
    private volatile Instant lastBarPoll;
    private volatile ScheduledFuture<?> watchdogTask;

    public GridTradingCoordinator(MarketGateway gateway,
                                  GridEngine engine,
                                  ExtremeProtectionService protection,
                                  TrendSignalService signalService,
                                  PriceValidator priceValidator,
                                  MarketStreamClient streamClient,
                                  Cache<String, Boolean> processedOrderEventsCache,
                                  GridProps props,
                                  ProtectionProps protectionProps,
                                  Clock clock,
                                  TaskScheduler gridTaskScheduler) {
        this.gateway = gateway;
        this.engine = engine;
        this.protection = protection;
        this.signalService = signalService;
        this.priceValidator = priceValidator;
        this.streamClient = streamClient;
        this.processedOrderEventsCache = processedOrderEventsCache;
        this.props = props;
        this.protectionProps = protectionProps;
        this.clock = clock;
        this.scheduler = gridTaskScheduler;
    }

    // ---------------------------------------------------------------------
    // Startup
    // ---------------------------------------------------------------------

    /**
     * Throws when the gateway cannot be initialized, which aborts startup.
     */
    @Override
    public void run(ApplicationArguments args) {
        log.info("GRID_STARTING symbol={} base={} spacing={} threshold={} limit={}",
                props.symbol(), props.baseQuantity(), props.gridSpacing(), props.positionThreshold(), props.positionLimit());
        gateway.initialize();

        try {
            signalService.initialize();
        } catch (GatewayException e) {
            log.warn("SIGNAL_INIT_FAILED continuing without a signal error={}", e.getMessage());
        }
        Instant now = clock.instant();
        syncPositionsIfDue(now);
        syncOrdersIfDue(now);
        if (protection.isHibernating()) {
            log.warn("GRID_STARTING_HIBERNATED status={}", protection.status());
        }

        Duration interval = protectionProps.watchdogInterval();
        watchdogTask = scheduler.scheduleWithFixedDelay(this::hibernationWatchdog, now.plus(interval), interval);
        streamClient.start(this);
        log.info("GRID_STARTED");
    }

    // ---------------------------------------------------------------------
    // Stream events
    // ---------------------------------------------------------------------

    @Override
    public void onBookTicker(BookTicker ticker) {
        if (stopped.get()) return;
        try {
            handleTick(ticker);
        } catch (Exception e) {
            log.error("TICK_HANDLER_ERROR error={}", e.toString(), e);
        }
    }

    void handleTick(BookTicker ticker) {
        if (ticker.bid() <= 0 || ticker.ask() <= 0) {
            log.warn("TICK_IGNORED bid={} ask={}", ticker.bid(), ticker.ask());
            return;
        }
        double mid = ticker.mid();
        PriceDecision decision = priceValidator.validate(mid);
        if (!decision.accepted()) {
            return;
        }
        engine.updateQuote(ticker.bid(), ticker.ask(), mid);

        Instant now = clock.instant();
        Instant last = lastProcessedAt;
        if (last != null && Duration.between(last, now).compareTo(props.tickThrottle()) < 0) {
            return;
        }
        lastProcessedAt = now;

        protection.recordPrice(mid);
        ProtectionDecision pd = protection.evaluate(mid, ticker.bid(), ticker.ask());
        switch (pd) {
            case HIBERNATING -> {
                return;
            }
            case TRIGGERED -> {
                engine.resetAfterFlatten();
                return;
            }
            case TRIGGER_FAILED, EXTREME_COOLDOWN -> {
                // no grid orders while the move is still extreme; bars keep flowing so the run can end
                pollBarsIfDue(now);
                return;
            }
            case RESUMED -> forceResync();
            default -> { }
        }

        runPeriodicChecks(now);
        if (lastPositionSync == null || lastOrderSync == null) {
            log.warn("GRID_ADJUST_DEFERRED reason=unsynced");
            return;
        }
        engine.adjustGrid();
    }

    private void runPeriodicChecks(Instant now) {
        syncPositionsIfDue(now);
        syncOrdersIfDue(now);
        pollBarsIfDue(now);
        try {
            signalService.refreshIfDue(now);
        } catch (GatewayException e) {
            log.warn("SIGNAL_REFRESH_FAILED error={}", e.getMessage());
        }
    }

    private void syncPositionsIfDue(Instant now) {
        if (!isDue(lastPositionSync, props.positionSyncInterval(), now)) return;
        try {
            engine.syncPositions();
            lastPositionSync = now;
        } catch (GatewayException e) {
            log.warn("POSITION_SYNC_FAILED error={}", e.getMessage());
        }
    }

    private void syncOrdersIfDue(Instant now) {
        if (!isDue(lastOrderSync, props.orderSyncInterval(), now)) return;
        try {
            engine.syncPendingOrders();
            lastOrderSync = now;
        } catch (GatewayException e) {
            log.warn("ORDER_SYNC_FAILED error={}", e.getMessage());
        }
    }

    /** REST fallback for bars the stream may have missed. */
    private void pollBarsIfDue(Instant now) {
        if (!isDue(lastBarPoll, props.barPollInterval(), now)) return;
        lastBarPoll = now;
        try {
            List<KlineBar> bars = gateway.fetchKlines(protectionProps.barTimeframe(), BAR_POLL_LIMIT);
            // last one is still forming
            for (int i = 0; i < bars.size() - 1; i++) {
                protection.onBar(bars.get(i));
            }
        } catch (GatewayException e) {
            log.warn("BAR_POLL_FAILED error={}", e.getMessage());
        }
    }

    private static boolean isDue(Instant last, Duration interval, Instant now) {
        return last == null || Duration.between(last, now).compareTo(interval) >= 0;
    }

    private void forceResync() {
        lastPositionSync = null;
        lastOrderSync = null;
    }

    @Override
    public void onKline(KlineBar bar, boolean closed) {
        if (!closed || stopped.get()) return;
        try {
            protection.onBar(bar);
        } catch (Exception e) {
            log.error("BAR_HANDLER_ERROR error={}", e.toString(), e);
        }
    }

    @Override
    public void onOrderUpdate(OrderUpdateEvent event) {
        if (stopped.get()) return;
        if (event.getSymbol() != null && !props.symbol().equalsIgnoreCase(event.getSymbol())) return;
        if (processedOrderEventsCache.asMap().putIfAbsent(event.dedupKey(), Boolean.TRUE) != null) {
            log.debug("ORDER_EVENT_DUPLICATE key={}", event.dedupKey());
            return;
        }
        try {
            engine.applyOrderUpdate(event);
        } catch (Exception e) {
            log.error("ORDER_HANDLER_ERROR id={} error={}", event.getOrderId(), e.toString(), e);
        }
    }

    @Override
    public void onStreamConnected() {
        // events may have been missed while disconnected
        forceResync();
    }

    @Override
    public void onStreamDisconnected(String reason) {
        log.warn("GRID_FEED_LOST reason={}", reason);
    }

    // ---------------------------------------------------------------------
    // Hibernation watchdog
    // ---------------------------------------------------------------------

    /**
     * Keeps hibernation-end evaluation alive when the feed is silent by
     * sampling the REST ticker instead.
     */
    void hibernationWatchdog() {
        if (stopped.get() || !protection.isHibernating()) return;
        Instant now = clock.instant();
        Instant last = lastProcessedAt;
        if (last != null && Duration.between(last, now).compareTo(protectionProps.watchdogInterval()) < 0) {
            return;
        }
        try {
            double price = gateway.fetchTicker();
            if (!priceValidator.validate(price).accepted()) return;
            protection.recordPrice(price);
            if (protection.evaluateHibernationEnd()) {
                log.warn("WATCHDOG_RESUMED feed silent since {}", last);
                forceResync();
            }
        } catch (GatewayException e) {
            log.warn("WATCHDOG_TICKER_FAILED error={}", e.getMessage());
        } catch (Exception e) {
            log.error("WATCHDOG_ERROR error={}", e.toString(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    @Override
    public String name() {
        return "grid-coordinator";
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        ScheduledFuture<?> task = watchdogTask;
        if (task != null) task.cancel(false);
        streamClient.stop();
        log.info("GRID_STOPPED positions={}", engine.snapshot().getPositions());
    }
}
