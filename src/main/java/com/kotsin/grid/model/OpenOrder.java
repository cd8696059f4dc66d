package com.kotsin.grid.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exchange order as returned by open-order and order-status queries.
 * reduceOnly is true for every order that closes its leg, including hedge-mode
 * closes the exchange does not flag itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenOrder {
    private String orderId;
    private String clientOrderId;
    private OrderSide side;
    private PositionSide positionSide;
    private OrderType type;
    private boolean reduceOnly;
    private double price;
    private double origQty;
    private double executedQty;
    private OrderStatus status;
    private long updateTime;

    public double remainingQty() {
        return Math.max(0.0, origQty - executedQty);
    }
}
