package com.kotsin.grid.protection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Short-horizon volatility: mean absolute tick-to-tick change over the last
 * {@code period} deltas. The first {@code baselineSamples} readings define the
 * baseline, captured once.
 */
public class VolatilityTracker {

    static final int MAX_PRICES = 100;
    static final int MAX_HISTORY = 50;

    private final int period;
    private final int baselineSamples;
    private final Deque<Double> prices = new ArrayDeque<>();
    private final Deque<Double> history = new ArrayDeque<>();

    private double current;
    private Double baseline;

    public VolatilityTracker(int period, int baselineSamples, Double persistedBaseline) {
        this.period = period;
        this.baselineSamples = baselineSamples;
        this.baseline = persistedBaseline;
    }

    /**
     * @return the volatility after this sample, 0 until enough prices are buffered
     */
    public synchronized double addSample(double price) {
        prices.addLast(price);
        if (prices.size() > MAX_PRICES) prices.removeFirst();
        if (prices.size() < period + 1) {
            current = 0.0;
            return current;
        }

        double sum = 0.0;
        Iterator<Double> it = prices.descendingIterator();
        double newer = it.next();
        for (int i = 0; i < period; i++) {
            double older = it.next();
            sum += Math.abs(newer - older);
            newer = older;
        }
        current = sum / period;

        history.addLast(current);
        if (history.size() > MAX_HISTORY) history.removeFirst();
        if (baseline == null && history.size() >= baselineSamples) {
            double total = 0.0;
            for (double v : history) total += v;
            baseline = total / history.size();
        }
        return current;
    }

    public synchronized double current() {
        return current;
    }

    public synchronized Double baseline() {
        return baseline;
    }

    public synchronized void clearBaseline() {
        baseline = null;
    }
}
