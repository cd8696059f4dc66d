package com.kotsin.grid.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kotsin.grid.broker.GatewayException;
import com.kotsin.grid.broker.MarketGateway;
import com.kotsin.grid.broker.MarketStreamClient;
import com.kotsin.grid.config.GridProps;
import com.kotsin.grid.config.ProtectionProps;
import com.kotsin.grid.engine.GridEngine;
import com.kotsin.grid.engine.GridSnapshot;
import com.kotsin.grid.model.BookTicker;
import com.kotsin.grid.model.KlineBar;
import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.OrderStatus;
import com.kotsin.grid.model.OrderUpdateEvent;
import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.protection.ExtremeProtectionService;
import com.kotsin.grid.protection.ProtectionDecision;
import com.kotsin.grid.signal.TrendSignalService;
import com.kotsin.grid.support.Bars;
import com.kotsin.grid.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GridTradingCoordinatorTest {

    private MarketGateway gateway;
    private GridEngine engine;
    private ExtremeProtectionService protection;
    private TrendSignalService signalService;
    private MarketStreamClient streamClient;
    private TaskScheduler scheduler;
    private MutableClock clock;
    private GridTradingCoordinator coordinator;

    @BeforeEach
    void setUp() {
        gateway = mock(MarketGateway.class);
        engine = mock(GridEngine.class);
        protection = mock(ExtremeProtectionService.class);
        signalService = mock(TrendSignalService.class);
        streamClient = mock(MarketStreamClient.class);
        scheduler = mock(TaskScheduler.class);
        clock = new MutableClock(Instant.parse("2026-05-04T09:00:00Z"));

        GridProps gridProps = new GridProps("XRPUSDC", 3, 0.001, 500, 200, 15,
                Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(30),
                Duration.ofSeconds(60), Duration.ofSeconds(300), 0.10, 10);
        ProtectionProps protectionProps = new ProtectionProps(11.0, 24, 1.5,
                Duration.ofSeconds(30), Duration.ofSeconds(1), Duration.ofSeconds(60),
                14, 20, "memory", "unused", Duration.ofSeconds(300), "1h");
        Cache<String, Boolean> cache = Caffeine.newBuilder().maximumSize(1000).build();

        when(protection.evaluate(anyDouble(), anyDouble(), anyDouble())).thenReturn(ProtectionDecision.PROCEED);
        when(engine.snapshot()).thenReturn(GridSnapshot.builder().build());

        coordinator = new GridTradingCoordinator(gateway, engine, protection, signalService,
                new PriceValidator(gridProps), streamClient, cache, gridProps, protectionProps, clock, scheduler);
    }

    private static BookTicker tick(double bid, double ask) {
        return new BookTicker("XRPUSDC", bid, ask, 0L);
    }

    private static OrderUpdateEvent update(String symbol, String id, OrderStatus status, double filled) {
        return OrderUpdateEvent.builder()
                .symbol(symbol).orderId(id).side(OrderSide.BUY).positionSide(PositionSide.LONG)
                .status(status).origQty(3).filledQty(filled).price(0.5)
                .build();
    }

    // ======================== TICK TESTS ========================

    @Test
    @DisplayName("Normal tick syncs on first use and runs the grid cycle")
    void testProceedRunsCycle() {
        coordinator.handleTick(tick(0.999, 1.001));

        verify(engine).updateQuote(eq(0.999), eq(1.001), anyDouble());
        verify(protection).recordPrice(anyDouble());
        verify(engine).syncPositions();
        verify(engine).syncPendingOrders();
        verify(signalService).refreshIfDue(any(Instant.class));
        verify(engine).adjustGrid();
    }

    @Test
    @DisplayName("Ticks inside the throttle window only update the quote")
    void testThrottle() {
        coordinator.handleTick(tick(0.999, 1.001));
        coordinator.handleTick(tick(0.998, 1.000));

        verify(engine, times(2)).updateQuote(anyDouble(), anyDouble(), anyDouble());
        verify(protection, times(1)).evaluate(anyDouble(), anyDouble(), anyDouble());
        verify(engine, times(1)).adjustGrid();

        clock.advance(Duration.ofSeconds(1));
        coordinator.handleTick(tick(0.999, 1.001));
        verify(engine, times(2)).adjustGrid();
    }

    @Test
    @DisplayName("Hibernation suppresses all grid activity")
    void testHibernationSuppressesGrid() {
        when(protection.evaluate(anyDouble(), anyDouble(), anyDouble())).thenReturn(ProtectionDecision.HIBERNATING);

        coordinator.handleTick(tick(0.999, 1.001));

        verify(engine, never()).adjustGrid();
        verify(engine, never()).syncPositions();
        verify(engine, never()).syncPendingOrders();
    }

    @Test
    @DisplayName("Trigger clears local grid state and stops the cycle")
    void testTriggeredClearsState() {
        when(protection.evaluate(anyDouble(), anyDouble(), anyDouble())).thenReturn(ProtectionDecision.TRIGGERED);

        coordinator.handleTick(tick(0.999, 1.001));

        verify(engine).resetAfterFlatten();
        verify(engine, never()).adjustGrid();
    }

    @ParameterizedTest
    @EnumSource(value = ProtectionDecision.class, names = {"TRIGGER_FAILED", "EXTREME_COOLDOWN"})
    @DisplayName("Extreme move without hibernation places no grid orders")
    void testExtremeWithoutHibernationSuppressesGrid(ProtectionDecision decision) {
        coordinator.handleTick(tick(0.999, 1.001));
        verify(engine, times(1)).adjustGrid();

        when(protection.evaluate(anyDouble(), anyDouble(), anyDouble())).thenReturn(decision);
        clock.advance(Duration.ofSeconds(2));
        coordinator.handleTick(tick(0.999, 1.001));
        clock.advance(Duration.ofSeconds(2));
        coordinator.handleTick(tick(0.999, 1.001));

        verify(engine, never()).resetAfterFlatten();
        verify(engine, times(1)).adjustGrid();
    }

    @Test
    @DisplayName("Resume forces a fresh sync before trading")
    void testResumeResyncs() {
        coordinator.handleTick(tick(0.999, 1.001));
        when(protection.evaluate(anyDouble(), anyDouble(), anyDouble())).thenReturn(ProtectionDecision.RESUMED);
        clock.advance(Duration.ofSeconds(2));
        coordinator.handleTick(tick(0.999, 1.001));

        verify(engine, times(2)).syncPositions();
        verify(engine, times(2)).syncPendingOrders();
        verify(engine, times(2)).adjustGrid();
    }

    @Test
    @DisplayName("Grid waits until positions have synced once")
    void testUnsyncedDefers() {
        doThrow(new GatewayException("timeout")).when(engine).syncPositions();

        coordinator.handleTick(tick(0.999, 1.001));

        verify(engine, never()).adjustGrid();
    }

    @Test
    @DisplayName("Jumping price is dropped before it reaches the engine")
    void testPriceJumpRejected() {
        coordinator.handleTick(tick(0.999, 1.001));
        clock.advance(Duration.ofSeconds(5));
        coordinator.handleTick(tick(4.999, 5.001));

        verify(engine, times(1)).updateQuote(anyDouble(), anyDouble(), anyDouble());
    }

    @Test
    @DisplayName("Empty book side is ignored")
    void testInvalidTouch() {
        coordinator.handleTick(tick(0.0, 1.001));
        verifyNoInteractions(engine, protection);
    }

    @Test
    @DisplayName("Closed bars from the poll are fed to protection, the forming bar is not")
    void testBarPollSkipsFormingBar() {
        List<KlineBar> bars = Bars.trending(3, 1.0, 1.01);
        when(gateway.fetchKlines(anyString(), anyInt())).thenReturn(bars);

        coordinator.handleTick(tick(0.999, 1.001));

        verify(protection).onBar(bars.get(0));
        verify(protection).onBar(bars.get(1));
        verify(protection, never()).onBar(bars.get(2));
    }

    // ======================== STREAM EVENT TESTS ========================

    @Test
    @DisplayName("Duplicate order events are applied once")
    void testOrderEventDedup() {
        coordinator.onOrderUpdate(update("XRPUSDC", "42", OrderStatus.NEW, 0));
        coordinator.onOrderUpdate(update("XRPUSDC", "42", OrderStatus.NEW, 0));
        coordinator.onOrderUpdate(update("XRPUSDC", "42", OrderStatus.FILLED, 3));

        verify(engine, times(2)).applyOrderUpdate(any(OrderUpdateEvent.class));
    }

    @Test
    @DisplayName("Order events for another symbol are ignored")
    void testOtherSymbolIgnored() {
        coordinator.onOrderUpdate(update("BTCUSDT", "1", OrderStatus.NEW, 0));
        verify(engine, never()).applyOrderUpdate(any());
    }

    @Test
    @DisplayName("Only closed stream bars reach protection")
    void testKlineForwarding() {
        KlineBar bar = Bars.trending(1, 1.0, 1.02).get(0);
        coordinator.onKline(bar, false);
        verify(protection, never()).onBar(any());
        coordinator.onKline(bar, true);
        verify(protection).onBar(bar);
    }

    @Test
    @DisplayName("Reconnect forces a resync on the next tick")
    void testReconnectResyncs() {
        coordinator.handleTick(tick(0.999, 1.001));
        coordinator.onStreamConnected();
        clock.advance(Duration.ofSeconds(2));
        coordinator.handleTick(tick(0.999, 1.001));

        verify(engine, times(2)).syncPositions();
    }

    // ======================== WATCHDOG TESTS ========================

    @Test
    @DisplayName("Watchdog samples the REST ticker while hibernating on a silent feed")
    void testWatchdogResumes() {
        when(protection.isHibernating()).thenReturn(true);
        when(protection.evaluateHibernationEnd()).thenReturn(true);
        when(gateway.fetchTicker()).thenReturn(0.75);

        coordinator.hibernationWatchdog();

        verify(protection).recordPrice(0.75);
        verify(protection).evaluateHibernationEnd();
    }

    @Test
    @DisplayName("Watchdog stays idle when not hibernating")
    void testWatchdogIdle() {
        when(protection.isHibernating()).thenReturn(false);
        coordinator.hibernationWatchdog();
        verify(gateway, never()).fetchTicker();
    }

    @Test
    @DisplayName("Watchdog stays idle while ticks are flowing")
    void testWatchdogWithLiveFeed() {
        when(protection.isHibernating()).thenReturn(true);
        when(protection.evaluate(anyDouble(), anyDouble(), anyDouble())).thenReturn(ProtectionDecision.HIBERNATING);
        coordinator.handleTick(tick(0.999, 1.001));
        clock.advance(Duration.ofSeconds(60));

        coordinator.hibernationWatchdog();

        verify(gateway, never()).fetchTicker();
    }

    // ======================== LIFECYCLE TESTS ========================

    @Test
    @DisplayName("Startup aborts when the gateway cannot be initialized")
    void testStartupFailure() {
        doThrow(new GatewayException("hedge mode off")).when(gateway).initialize();

        assertThrows(GatewayException.class, () -> coordinator.run(new DefaultApplicationArguments()));
        verify(streamClient, never()).start(any());
    }

    @Test
    @DisplayName("Startup initializes, syncs and opens the stream")
    void testStartup() {
        coordinator.run(new DefaultApplicationArguments());

        verify(gateway).initialize();
        verify(signalService).initialize();
        verify(engine).syncPositions();
        verify(engine).syncPendingOrders();
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(300)));
        verify(streamClient).start(coordinator);
    }

    @Test
    @DisplayName("Stop is idempotent and silences further events")
    void testStop() {
        coordinator.stop();
        coordinator.stop();
        coordinator.onBookTicker(tick(0.999, 1.001));

        verify(streamClient, times(1)).stop();
        verify(engine, never()).updateQuote(anyDouble(), anyDouble(), anyDouble());
        assertEquals("grid-coordinator", coordinator.name());
    }
}
