package com.kotsin.grid.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A filled grid order, kept for reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {
    private Instant timestamp;
    private String symbol;
    private String orderId;
    private OrderSide side;
    private PositionSide positionSide;
    private double price;
    private double quantity;
    private boolean reduceOnly;
    private String gridType; // "long" / "short"

    public static TradeRecord fromFill(OrderUpdateEvent event, boolean closing, Instant at) {
        return TradeRecord.builder()
                .timestamp(at)
                .symbol(event.getSymbol())
                .orderId(event.getOrderId())
                .side(event.getSide())
                .positionSide(event.getPositionSide())
                .price(event.executionPrice())
                .quantity(event.getFilledQty())
                .reduceOnly(closing)
                .gridType(event.getPositionSide() == PositionSide.LONG ? "long" : "short")
                .build();
    }
}
