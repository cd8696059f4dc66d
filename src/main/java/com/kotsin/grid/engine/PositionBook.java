package com.kotsin.grid.engine;

import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.model.PositionSnapshot;

/**
 * Local view of both legs. Guarded by the engine lock.
 */
public class PositionBook {

    private double longQty;
    private double shortQty;

    public double get(PositionSide side) {
        return side == PositionSide.LONG ? longQty : shortQty;
    }

    /** Applies a fill delta, clamped at zero. */
    public void apply(PositionSide side, double delta) {
        set(side, get(side) + delta);
    }

    public void set(PositionSide side, double qty) {
        double v = Math.max(0.0, qty);
        if (side == PositionSide.LONG) longQty = v;
        else shortQty = v;
    }

    public void replaceWith(PositionSnapshot snapshot) {
        longQty = Math.max(0.0, snapshot.longQty());
        shortQty = Math.max(0.0, snapshot.shortQty());
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(longQty, shortQty);
    }
}
