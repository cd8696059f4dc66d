package com.kotsin.grid.engine;

import com.kotsin.grid.model.PositionSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridBoundsTest {

    @Test
    @DisplayName("Long replenishes below and takes profit above")
    void testLongBounds() {
        GridBounds b = GridBounds.compute(PositionSide.LONG, 100.0, 0.002, 0.001);
        assertEquals(99.8, b.lower(), 1e-9);
        assertEquals(100.1, b.upper(), 1e-9);
        assertEquals(b.lower(), b.replenishmentPrice());
        assertEquals(b.upper(), b.takeProfitPrice());
    }

    @Test
    @DisplayName("Short replenishes above and takes profit below")
    void testShortBounds() {
        GridBounds b = GridBounds.compute(PositionSide.SHORT, 100.0, 0.002, 0.001);
        assertEquals(99.9, b.lower(), 1e-9);
        assertEquals(100.2, b.upper(), 1e-9);
        assertEquals(b.upper(), b.replenishmentPrice());
        assertEquals(b.lower(), b.takeProfitPrice());
    }
}
