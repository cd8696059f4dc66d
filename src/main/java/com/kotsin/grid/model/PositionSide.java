package com.kotsin.grid.model;

/**
 * Hedge-mode position leg. Each leg is opened and closed independently.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /** Order side that grows this leg. */
    public OrderSide openingSide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    /** Order side that shrinks this leg. */
    public OrderSide closingSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }

    public PositionSide opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
