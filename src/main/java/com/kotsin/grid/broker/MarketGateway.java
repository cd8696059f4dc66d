package com.kotsin.grid.broker;

import com.kotsin.grid.model.KlineBar;
import com.kotsin.grid.model.OpenOrder;
import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.OrderType;
import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.model.PositionSnapshot;

import java.util.List;

/**
 * Exchange capabilities the grid needs for its one configured instrument.
 * Every method may throw {@link GatewayException}.
 */
public interface MarketGateway {

    /**
     * Verifies hedge mode, sets leverage and loads symbol precision.
     * Failure here is fatal for startup.
     */
    void initialize() throws GatewayException;

    /**
     * Places an order and returns the exchange order-id.
     *
     * @param price required for LIMIT, ignored for MARKET (may be null)
     */
    String placeOrder(OrderSide side,
                      Double price,
                      double quantity,
                      boolean reduceOnly,
                      PositionSide positionSide,
                      OrderType type) throws GatewayException;

    void cancelOrder(String orderId) throws GatewayException;

    List<OpenOrder> fetchOpenOrders() throws GatewayException;

    OpenOrder fetchOrder(String orderId) throws GatewayException;

    PositionSnapshot fetchPosition() throws GatewayException;

    /** Last traded price. */
    double fetchTicker() throws GatewayException;

    /**
     * Most recent bars, oldest first. The last element is usually the bar
     * still forming.
     */
    List<KlineBar> fetchKlines(String timeframe, int limit) throws GatewayException;

    double roundPrice(double price);

    double roundQuantity(double quantity);

    String openUserDataStream() throws GatewayException;

    void keepAliveUserDataStream(String listenKey) throws GatewayException;
}
