package com.kotsin.grid.signal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TrendIndicatorsTest {

    private static final double EPS = 1e-9;

    // ======================== EMA TESTS ========================

    @Test
    @DisplayName("EMA is seeded with the first value")
    void testEmaSeed() {
        double[] ema = TrendIndicators.ema(new double[]{1, 2, 3}, 3);
        assertArrayEquals(new double[]{1.0, 1.5, 2.25}, ema, EPS);
    }

    @Test
    @DisplayName("EMA of a constant series is the constant")
    void testEmaConstant() {
        double[] values = new double[50];
        Arrays.fill(values, 4.2);
        double[] ema = TrendIndicators.ema(values, 20);
        assertEquals(4.2, ema[49], EPS);
    }

    @Test
    @DisplayName("Empty input gives empty output")
    void testEmaEmpty() {
        assertEquals(0, TrendIndicators.ema(new double[0], 5).length);
    }

    // ======================== ADX TESTS ========================

    @Test
    @DisplayName("Wilder smoothing skips the undefined first entry in its seed")
    void testWilderSeed() {
        double[] s = TrendIndicators.wilder(new double[]{Double.NaN, 2, 4, 6, 8}, 3);
        assertTrue(Double.isNaN(s[0]));
        assertTrue(Double.isNaN(s[1]));
        assertEquals(3.0, s[2], EPS);
        assertEquals(3.0 - 1.0 + 6.0, s[3], EPS);
        assertEquals(8.0 - 8.0 / 3 + 8.0, s[4], EPS);
    }

    @Test
    @DisplayName("Steady rise gives a strong ADX led by +DI")
    void testAdxRising() {
        int n = 80;
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        for (int i = 0; i < n; i++) {
            close[i] = 100 + i;
            high[i] = close[i] + 0.5;
            low[i] = close[i] - 0.5;
        }
        TrendIndicators.Adx adx = TrendIndicators.adx(high, low, close, 14);

        assertTrue(Double.isNaN(adx.adx()[5]), "No value before the first full window");
        assertTrue(adx.lastAdx() > 25, "ADX was " + adx.lastAdx());
        assertTrue(adx.lastPlusDi() > adx.lastMinusDi());
        assertEquals(0.0, adx.lastMinusDi(), EPS);
    }

    @Test
    @DisplayName("Equal up and down moves count as -DM")
    void testDirectionalMoveTie() {
        int n = 40;
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        for (int i = 0; i < n; i++) {
            high[i] = 10 + i;
            low[i] = 10 - i;
            close[i] = 10;
        }
        TrendIndicators.Adx adx = TrendIndicators.adx(high, low, close, 14);

        assertEquals(0.0, adx.lastPlusDi(), EPS);
        assertTrue(adx.lastMinusDi() > 0);
    }
}
