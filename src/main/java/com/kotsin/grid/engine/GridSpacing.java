package com.kotsin.grid.engine;

import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.signal.SpacingAdjustment;

/**
 * Current replenishment and take-profit spacing of both legs, as fractions
 * of price. Adjustments compound until {@link #reset()}.
 */
public class GridSpacing {

    private final double base;
    private double longGrid;
    private double longProfit;
    private double shortGrid;
    private double shortProfit;

    public GridSpacing(double base) {
        this.base = base;
        reset();
    }

    public void reset() {
        longGrid = base;
        longProfit = base;
        shortGrid = base;
        shortProfit = base;
    }

    public void apply(SpacingAdjustment adj) {
        longGrid *= adj.longGridMultiplier();
        longProfit *= adj.longProfitMultiplier();
        shortGrid *= adj.shortGridMultiplier();
        shortProfit *= adj.shortProfitMultiplier();
    }

    public double replenishment(PositionSide side) {
        return side == PositionSide.LONG ? longGrid : shortGrid;
    }

    public double takeProfit(PositionSide side) {
        return side == PositionSide.LONG ? longProfit : shortProfit;
    }

    public double base() {
        return base;
    }
}
