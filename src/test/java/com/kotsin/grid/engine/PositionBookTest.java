package com.kotsin.grid.engine;

import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.model.PositionSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionBookTest {

    @Test
    @DisplayName("Deltas accumulate per leg and clamp at zero")
    void testApplyClampsAtZero() {
        PositionBook book = new PositionBook();
        book.apply(PositionSide.LONG, 5);
        book.apply(PositionSide.LONG, -2);
        assertEquals(3.0, book.get(PositionSide.LONG), 1e-9);

        book.apply(PositionSide.LONG, -7);
        assertEquals(0.0, book.get(PositionSide.LONG), 1e-9, "Overshooting close stops at zero");

        book.apply(PositionSide.SHORT, -1);
        assertEquals(0.0, book.get(PositionSide.SHORT), 1e-9);
    }

    @Test
    @DisplayName("Snapshot replace drops negative quantities")
    void testReplaceWith() {
        PositionBook book = new PositionBook();
        book.replaceWith(new PositionSnapshot(-4, 6));
        assertEquals(new PositionSnapshot(0, 6), book.snapshot());
    }
}
