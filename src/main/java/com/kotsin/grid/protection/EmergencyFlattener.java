package com.kotsin.grid.protection;

import com.kotsin.grid.broker.GatewayException;
import com.kotsin.grid.broker.MarketGateway;
import com.kotsin.grid.config.ProtectionProps;
import com.kotsin.grid.model.OpenOrder;
import com.kotsin.grid.model.OrderStatus;
import com.kotsin.grid.model.OrderType;
import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.model.PositionSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Cancels every open order and closes both legs, all requests in parallel.
 * A close counts once the exchange accepts it; the fill wait is only logged.
 */
@Component
@Slf4j
public class EmergencyFlattener {

    /** Closing limit price crosses the touch by this fraction. */
    static final double CLOSE_THROUGH = 0.005;

    private final MarketGateway gateway;
    private final ProtectionProps props;
    private final ExecutorService emergencyExecutor;

    public EmergencyFlattener(MarketGateway gateway, ProtectionProps props, ExecutorService emergencyExecutor) {
        this.gateway = gateway;
        this.props = props;
        this.emergencyExecutor = emergencyExecutor;
    }

    /** @return true only if every open order was cancelled */
    public boolean cancelAllOrders() {
        List<OpenOrder> orders;
        try {
            orders = gateway.fetchOpenOrders();
        } catch (GatewayException e) {
            log.error("EMERGENCY_CANCEL_LIST_FAILED error={}", e.getMessage());
            return false;
        }
        if (orders.isEmpty()) {
            log.info("EMERGENCY_CANCEL nothing resting");
            return true;
        }

        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        for (OpenOrder o : orders) {
            futures.add(CompletableFuture.supplyAsync(() -> cancelOne(o.getOrderId()), emergencyExecutor));
        }
        long cancelled = futures.stream().map(CompletableFuture::join).filter(Boolean::booleanValue).count();
        log.warn("EMERGENCY_CANCEL done={}/{}", cancelled, orders.size());
        return cancelled == orders.size();
    }

    private boolean cancelOne(String orderId) {
        try {
            gateway.cancelOrder(orderId);
            return true;
        } catch (GatewayException e) {
            log.error("EMERGENCY_CANCEL_FAILED id={} error={}", orderId, e.getMessage());
            return false;
        }
    }

    /**
     * Closes every non-zero leg with a reduce-only limit order through the touch.
     *
     * @return true only if every close was accepted
     */
    public boolean flattenAllPositions(double bid, double ask, double lastPrice) {
        PositionSnapshot snapshot;
        try {
            snapshot = gateway.fetchPosition();
        } catch (GatewayException e) {
            log.error("EMERGENCY_POSITION_FETCH_FAILED error={}", e.getMessage());
            return false;
        }
        if (snapshot.isFlat()) {
            log.info("EMERGENCY_FLATTEN already flat");
            return true;
        }

        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        for (PositionSide side : PositionSide.values()) {
            double qty = snapshot.of(side);
            if (qty <= 0) continue;
            double touch = side == PositionSide.LONG ? bid : ask;
            double reference = touch > 0 ? touch : lastPrice;
            futures.add(CompletableFuture.supplyAsync(() -> closeLeg(side, qty, reference), emergencyExecutor));
        }
        long closed = futures.stream().map(CompletableFuture::join).filter(Boolean::booleanValue).count();
        log.warn("EMERGENCY_FLATTEN closed={}/{} long={} short={}", closed, futures.size(),
                snapshot.longQty(), snapshot.shortQty());
        return closed == futures.size();
    }

    private boolean closeLeg(PositionSide side, double qty, double reference) {
        double price = side == PositionSide.LONG ? reference * (1 - CLOSE_THROUGH) : reference * (1 + CLOSE_THROUGH);
        String orderId;
        try {
            orderId = gateway.placeOrder(side.closingSide(), price, qty, true, side, OrderType.LIMIT);
        } catch (GatewayException e) {
            log.error("EMERGENCY_CLOSE_REJECTED side={} qty={} price={} error={}", side, qty, price, e.getMessage());
            return false;
        }
        log.warn("EMERGENCY_CLOSE_PLACED side={} id={} qty={} price={}", side, orderId, qty, price);
        if (!awaitFill(orderId, side)) {
            log.error("EMERGENCY_CLOSE_UNCONFIRMED side={} id={} check the leg manually", side, orderId);
        }
        return true;
    }

    /**
     * Polls the order until FILLED (true), a dead end state (false) or timeout (false).
     */
    boolean awaitFill(String orderId, PositionSide side) {
        long deadline = System.nanoTime() + props.emergencyCloseTimeout().toNanos();
        while (System.nanoTime() < deadline) {
            try {
                OpenOrder o = gateway.fetchOrder(orderId);
                OrderStatus status = o.getStatus();
                if (status == OrderStatus.FILLED) {
                    log.warn("EMERGENCY_CLOSE_FILLED side={} id={}", side, orderId);
                    return true;
                }
                if (status == OrderStatus.CANCELED || status == OrderStatus.REJECTED || status == OrderStatus.EXPIRED) {
                    log.error("EMERGENCY_CLOSE_DEAD side={} id={} status={}", side, orderId, status);
                    return false;
                }
            } catch (GatewayException e) {
                log.warn("EMERGENCY_CLOSE_POLL_FAILED side={} id={} error={}", side, orderId, e.getMessage());
            }
            try {
                TimeUnit.MILLISECONDS.sleep(props.fillPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        log.error("EMERGENCY_CLOSE_TIMEOUT side={} id={} timeout={}s", side, orderId, props.emergencyCloseTimeout().toSeconds());
        return false;
    }
}
