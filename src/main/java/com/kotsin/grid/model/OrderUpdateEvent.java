package com.kotsin.grid.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order lifecycle update pushed on the user data stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderUpdateEvent {
    private String symbol;
    private String orderId;
    private String clientOrderId;
    private OrderSide side;
    private PositionSide positionSide;
    private OrderType type;
    private OrderStatus status;
    private boolean reduceOnly;
    private double price;
    private double origQty;
    private double filledQty;     // cumulative
    private double lastFillPrice;
    private double avgPrice;
    private long eventTime;

    public double remainingQty() {
        return Math.max(0.0, origQty - filledQty);
    }

    /** Best available execution price for trade records. */
    public double executionPrice() {
        if (avgPrice > 0) return avgPrice;
        if (lastFillPrice > 0) return lastFillPrice;
        return price;
    }

    public String dedupKey() {
        return orderId + ":" + status + ":" + filledQty;
    }
}
