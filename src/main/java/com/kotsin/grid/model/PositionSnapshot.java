package com.kotsin.grid.model;

/**
 * Absolute size of both hedge legs, never negative.
 */
public record PositionSnapshot(double longQty, double shortQty) {

    public static final PositionSnapshot FLAT = new PositionSnapshot(0.0, 0.0);

    public double of(PositionSide side) {
        return side == PositionSide.LONG ? longQty : shortQty;
    }

    public boolean isFlat() {
        return longQty <= 0 && shortQty <= 0;
    }
}
