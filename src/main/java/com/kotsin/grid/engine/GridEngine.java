package com.kotsin.grid.engine;

import com.kotsin.grid.broker.GatewayException;
import com.kotsin.grid.broker.MarketGateway;
import com.kotsin.grid.config.GridProps;
import com.kotsin.grid.model.OpenOrder;
import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.OrderStatus;
import com.kotsin.grid.model.OrderType;
import com.kotsin.grid.model.OrderUpdateEvent;
import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.model.TradeRecord;
import com.kotsin.grid.signal.SpacingAdjustment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one take-profit and one replenishment order resting per leg and
 * reconciles local positions and order counters with the exchange.
 *
 * <p>Every mutation runs under a single lock: order events, grid adjustments
 * and full resyncs never interleave.
 */
@Service
@Slf4j
public class GridEngine {

    /** Opposite-exposure reduction crosses the last price by this fraction. */
    static final double REDUCE_THROUGH = 0.001;
    static final double REDUCE_FRACTION = 0.5;

    private final MarketGateway gateway;
    private final GridProps props;
    private final Clock clock;
    private final TradeRecordSink tradeRecordSink;

    private final ReentrantLock lock = new ReentrantLock();
    private final PositionBook positions = new PositionBook();
    private final PendingOrderCounters counters = new PendingOrderCounters();
    private final GridSpacing spacing;
    private final Map<PositionSide, Instant> lastEntryAt = new EnumMap<>(PositionSide.class);

    private volatile double latestPrice;
    private volatile double bestBid;
    private volatile double bestAsk;

    public GridEngine(MarketGateway gateway, GridProps props, Clock clock, TradeRecordSink tradeRecordSink) {
        this.gateway = gateway;
        this.props = props;
        this.clock = clock;
        this.tradeRecordSink = tradeRecordSink;
        this.spacing = new GridSpacing(props.gridSpacing());
    }

    public void updateQuote(double bid, double ask, double mid) {
        this.bestBid = bid;
        this.bestAsk = ask;
        this.latestPrice = mid;
    }

    // ---------------------------------------------------------------------
    // Adjustment cycle
    // ---------------------------------------------------------------------

    /**
     * One full cycle at the latest price: reduce hedged exposure if both legs
     * are heavy, then adjust each leg.
     */
    public void adjustGrid() {
        lock.lock();
        try {
            double price = latestPrice;
            if (price <= 0) {
                log.debug("GRID_ADJUST_SKIPPED no price yet");
                return;
            }
            reduceOppositeExposure();
            for (PositionSide side : PositionSide.values()) {
                adjustSide(side, price);
            }
        } finally {
            lock.unlock();
        }
    }

    public void adjustSide(PositionSide side, double price) {
        lock.lock();
        try {
            double position = positions.get(side);
            if (position == 0) {
                placeEntryOrder(side);
                return;
            }

            double qty = computeTakeProfitQuantity(position, side);
            boolean conservative = position > props.positionThreshold();
            if (countersConsistent(side, qty)) {
                return;
            }
            if (!conservative) {
                log.info("GRID_COUNTER_RECHECK side={} entry={} takeProfit={} expected<={}",
                        side, counters.get(OrderRole.entry(side)), counters.get(OrderRole.takeProfit(side)), qty);
                syncPendingOrders();
                if (countersConsistent(side, qty)) {
                    return;
                }
            }

            if (conservative) {
                placeConservativeTakeProfit(side, price, position, qty);
            } else {
                placeGridPair(side, price, qty);
            }
        } catch (GatewayException e) {
            log.error("GRID_ADJUST_ABANDONED side={} error={}", side, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private boolean countersConsistent(PositionSide side, double qty) {
        double entry = counters.get(OrderRole.entry(side));
        double tp = counters.get(OrderRole.takeProfit(side));
        return entry > 0 && entry <= qty && tp > 0 && tp <= qty;
    }

    private void placeEntryOrder(PositionSide side) {
        Instant now = clock.instant();
        Instant last = lastEntryAt.get(side);
        if (last != null && Duration.between(last, now).compareTo(props.orderFirstTime()) < 0) {
            log.info("GRID_ENTRY_SKIPPED side={} lastEntry={} minGap={}s", side, last, props.orderFirstTime().toSeconds());
            return;
        }
        double touch = side == PositionSide.LONG ? bestBid : bestAsk;
        if (touch <= 0) {
            log.warn("GRID_ENTRY_SKIPPED side={} reason=no-quote", side);
            return;
        }
        cancelSide(side);
        gateway.placeOrder(side.openingSide(), touch, props.baseQuantity(), false, side, OrderType.LIMIT);
        lastEntryAt.put(side, now);
        log.info("GRID_ENTRY_PLACED side={} price={} qty={}", side, touch, props.baseQuantity());
    }

    private void placeConservativeTakeProfit(PositionSide side, double price, double position, double qty) {
        if (counters.get(OrderRole.takeProfit(side)) > 0) {
            log.debug("GRID_CONSERVATIVE_HOLD side={} takeProfit already resting", side);
            return;
        }
        double opposite = positions.get(side.opposite());
        double ratio = (position / Math.max(opposite, 1.0)) / 100.0 + 1.0;
        double tpPrice = side == PositionSide.LONG ? price * ratio : price / ratio;
        gateway.placeOrder(side.closingSide(), tpPrice, qty, true, side, OrderType.LIMIT);
        log.info("GRID_CONSERVATIVE_TP side={} position={} opposite={} ratio={} price={} qty={}",
                side, position, opposite, ratio, tpPrice, qty);
    }

    private void placeGridPair(PositionSide side, double price, double qty) {
        GridBounds bounds = GridBounds.compute(side, price, spacing.replenishment(side), spacing.takeProfit(side));
        cancelSide(side);
        gateway.placeOrder(side.closingSide(), bounds.takeProfitPrice(), qty, true, side, OrderType.LIMIT);
        gateway.placeOrder(side.openingSide(), bounds.replenishmentPrice(), qty, false, side, OrderType.LIMIT);
        log.info("GRID_PAIR_PLACED side={} mid={} takeProfit={} replenish={} qty={}",
                side, price, bounds.takeProfitPrice(), bounds.replenishmentPrice(), qty);
    }

    /**
     * Base size, doubled once the leg grows past the position limit. Also
     * sizes replenishment orders.
     */
    public double computeTakeProfitQuantity(double position, PositionSide side) {
        double size = position > props.positionLimit() ? props.baseQuantity() * 2 : props.baseQuantity();
        return Math.min(position, size);
    }

    /**
     * When both legs sit above the threshold, trims half of the smaller one
     * from each side with reduce-only orders through the market.
     */
    public void reduceOppositeExposure() {
        lock.lock();
        try {
            double longQty = positions.get(PositionSide.LONG);
            double shortQty = positions.get(PositionSide.SHORT);
            double threshold = props.positionThreshold();
            if (longQty <= threshold || shortQty <= threshold) return;

            double reduce = Math.min(longQty, shortQty) * REDUCE_FRACTION;
            if (reduce <= 0) return;
            double price = latestPrice;
            gateway.placeOrder(OrderSide.SELL, price * (1 - REDUCE_THROUGH), reduce, true, PositionSide.LONG, OrderType.LIMIT);
            gateway.placeOrder(OrderSide.BUY, price * (1 + REDUCE_THROUGH), reduce, true, PositionSide.SHORT, OrderType.LIMIT);
            log.info("GRID_EXPOSURE_REDUCED long={} short={} qty={}", longQty, shortQty, reduce);
        } catch (GatewayException e) {
            log.error("GRID_EXPOSURE_REDUCE_FAILED error={}", e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Reconciliation
    // ---------------------------------------------------------------------

    /** Replaces all four counters from the exchange's open orders. */
    public void syncPendingOrders() {
        lock.lock();
        try {
            List<OpenOrder> open = gateway.fetchOpenOrders();
            counters.replaceWith(open);
            log.debug("ORDERS_SYNCED open={} counters={}", open.size(), counters.asMap());
        } finally {
            lock.unlock();
        }
    }

    public void syncPositions() {
        lock.lock();
        try {
            positions.replaceWith(gateway.fetchPosition());
            log.debug("POSITIONS_SYNCED {}", positions.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels this leg's entry and take-profit orders; the other leg is untouched.
     */
    public void cancelSide(PositionSide side) {
        lock.lock();
        try {
            boolean failed = false;
            for (OpenOrder o : gateway.fetchOpenOrders()) {
                OrderRole role = OrderRole.classify(o.getSide(), o.getPositionSide(), o.isReduceOnly());
                if (role == null || role.positionSide() != side) continue;
                try {
                    gateway.cancelOrder(o.getOrderId());
                } catch (GatewayException e) {
                    failed = true;
                    log.warn("ORDER_CANCEL_FAILED id={} side={} error={}", o.getOrderId(), side, e.getMessage());
                }
            }
            if (failed) {
                syncPendingOrders();
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Order events
    // ---------------------------------------------------------------------

    public void applyOrderUpdate(OrderUpdateEvent event) {
        lock.lock();
        try {
            OrderRole role = OrderRole.of(event.getSide(), event.getPositionSide());
            if (role == null) return;
            OrderStatus status = event.getStatus();
            switch (status) {
                case NEW -> counters.add(role, event.remainingQty());
                case FILLED -> {
                    double filled = event.getFilledQty();
                    positions.apply(role.positionSide(), role.reduceOnly() ? -filled : filled);
                    counters.subtract(role, filled);
                    log.info("ORDER_FILLED id={} role={} qty={} price={} positions={}",
                            event.getOrderId(), role, filled, event.executionPrice(), positions.snapshot());
                    recordTrade(event, role);
                }
                case CANCELED, EXPIRED -> counters.subtract(role, event.remainingQty());
                default -> { }
            }
            if (status.isTerminal()) {
                try {
                    syncPendingOrders();
                    if (status == OrderStatus.FILLED) {
                        syncPositions();
                    }
                } catch (GatewayException e) {
                    log.warn("ORDER_EVENT_RESYNC_FAILED id={} error={}", event.getOrderId(), e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void recordTrade(OrderUpdateEvent event, OrderRole role) {
        try {
            tradeRecordSink.record(TradeRecord.fromFill(event, role.reduceOnly(), clock.instant()));
        } catch (Exception e) {
            log.warn("TRADE_RECORD_FAILED id={} error={}", event.getOrderId(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // Spacing and protection hooks
    // ---------------------------------------------------------------------

    public void applySpacingAdjustment(SpacingAdjustment adj) {
        lock.lock();
        try {
            spacing.apply(adj);
            log.info("SPACING_ADJUSTED longGrid={} longProfit={} shortGrid={} shortProfit={}",
                    spacing.replenishment(PositionSide.LONG), spacing.takeProfit(PositionSide.LONG),
                    spacing.replenishment(PositionSide.SHORT), spacing.takeProfit(PositionSide.SHORT));
        } finally {
            lock.unlock();
        }
    }

    public void resetSpacing() {
        lock.lock();
        try {
            spacing.reset();
            log.info("SPACING_RESET base={}", spacing.base());
        } finally {
            lock.unlock();
        }
    }

    /** Local state after an emergency flatten: nothing open, nothing resting. */
    public void resetAfterFlatten() {
        lock.lock();
        try {
            positions.set(PositionSide.LONG, 0.0);
            positions.set(PositionSide.SHORT, 0.0);
            counters.clear();
            log.info("GRID_STATE_CLEARED after emergency flatten");
        } finally {
            lock.unlock();
        }
    }

    public GridSnapshot snapshot() {
        lock.lock();
        try {
            return GridSnapshot.builder()
                    .symbol(props.symbol())
                    .latestPrice(latestPrice)
                    .bestBid(bestBid)
                    .bestAsk(bestAsk)
                    .positions(positions.snapshot())
                    .pendingOrders(counters.asMap())
                    .longGridSpacing(spacing.replenishment(PositionSide.LONG))
                    .longProfitSpacing(spacing.takeProfit(PositionSide.LONG))
                    .shortGridSpacing(spacing.replenishment(PositionSide.SHORT))
                    .shortProfitSpacing(spacing.takeProfit(PositionSide.SHORT))
                    .lastLongEntry(lastEntryAt.get(PositionSide.LONG))
                    .lastShortEntry(lastEntryAt.get(PositionSide.SHORT))
                    .build();
        } finally {
            lock.unlock();
        }
    }
}
