package com.kotsin.grid.engine;

import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.PositionSide;

/**
 * The four kinds of resting grid order, one counter each.
 */
public enum OrderRole {
    LONG_ENTRY(OrderSide.BUY, PositionSide.LONG, false),
    LONG_TAKE_PROFIT(OrderSide.SELL, PositionSide.LONG, true),
    SHORT_ENTRY(OrderSide.SELL, PositionSide.SHORT, false),
    SHORT_TAKE_PROFIT(OrderSide.BUY, PositionSide.SHORT, true);

    private final OrderSide side;
    private final PositionSide positionSide;
    private final boolean reduceOnly;

    OrderRole(OrderSide side, PositionSide positionSide, boolean reduceOnly) {
        this.side = side;
        this.positionSide = positionSide;
        this.reduceOnly = reduceOnly;
    }

    public OrderSide side() {
        return side;
    }

    public PositionSide positionSide() {
        return positionSide;
    }

    public boolean reduceOnly() {
        return reduceOnly;
    }

    public static OrderRole entry(PositionSide ps) {
        return ps == PositionSide.LONG ? LONG_ENTRY : SHORT_ENTRY;
    }

    public static OrderRole takeProfit(PositionSide ps) {
        return ps == PositionSide.LONG ? LONG_TAKE_PROFIT : SHORT_TAKE_PROFIT;
    }

    /**
     * Strict match on all three attributes, or null. Used when classifying a
     * full open-order snapshot.
     */
    public static OrderRole classify(OrderSide side, PositionSide ps, boolean reduceOnly) {
        OrderRole role = of(side, ps);
        return role != null && role.reduceOnly == reduceOnly ? role : null;
    }

    /**
     * Match by direction alone. In hedge mode the side and leg fully determine
     * whether an order opens or closes.
     */
    public static OrderRole of(OrderSide side, PositionSide ps) {
        if (side == null || ps == null) return null;
        if (ps == PositionSide.LONG) return side == OrderSide.BUY ? LONG_ENTRY : LONG_TAKE_PROFIT;
        return side == OrderSide.SELL ? SHORT_ENTRY : SHORT_TAKE_PROFIT;
    }
}
