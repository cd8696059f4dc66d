package com.kotsin.grid.engine;

import com.kotsin.grid.model.PositionSide;

/**
 * Price band of one leg around the reference price. Recomputed at every
 * placement decision, never stored.
 */
public record GridBounds(PositionSide side, double mid, double lower, double upper) {

    public static GridBounds compute(PositionSide side, double mid, double replenishSpacing, double takeProfitSpacing) {
        if (side == PositionSide.LONG) {
            return new GridBounds(side, mid, mid * (1 - replenishSpacing), mid * (1 + takeProfitSpacing));
        }
        return new GridBounds(side, mid, mid * (1 - takeProfitSpacing), mid * (1 + replenishSpacing));
    }

    /** Long buys below, short sells above. */
    public double replenishmentPrice() {
        return side == PositionSide.LONG ? lower : upper;
    }

    public double takeProfitPrice() {
        return side == PositionSide.LONG ? upper : lower;
    }
}
