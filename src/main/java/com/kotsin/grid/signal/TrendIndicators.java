package com.kotsin.grid.signal;

/**
 * EMA and Wilder ADX over plain price arrays.
 */
public final class TrendIndicators {

    private TrendIndicators() {
    }

    /**
     * Exponential moving average with alpha = 2/(n+1), seeded with the first value.
     */
    public static double[] ema(double[] values, int period) {
        double[] out = new double[values.length];
        if (values.length == 0) return out;
        double alpha = 2.0 / (period + 1);
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }

    /**
     * Average directional index. Entries before the first complete window are NaN.
     */
    public static Adx adx(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] tr = new double[n];
        double[] plusDm = new double[n];
        double[] minusDm = new double[n];

        if (n > 0) tr[0] = Double.NaN; // no previous close
        for (int i = 1; i < n; i++) {
            double hl = high[i] - low[i];
            double hc = Math.abs(high[i] - close[i - 1]);
            double lc = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(hl, Math.max(hc, lc));

            double up = high[i] - high[i - 1];
            double down = low[i - 1] - low[i];
            double p = up > 0 ? up : 0.0;
            double m = down > 0 ? down : 0.0;
            // only the larger move counts; a tie keeps -DM
            if (p > 0 && m > 0 && p <= m) p = 0.0;
            if (p > 0 && m > 0 && m <= p) m = 0.0;
            plusDm[i] = p;
            minusDm[i] = m;
        }

        double[] trS = wilder(tr, period);
        double[] plusS = wilder(plusDm, period);
        double[] minusS = wilder(minusDm, period);

        double[] plusDi = new double[n];
        double[] minusDi = new double[n];
        double[] dx = new double[n];
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(trS[i]) || trS[i] == 0) {
                plusDi[i] = Double.NaN;
                minusDi[i] = Double.NaN;
                dx[i] = Double.NaN;
                continue;
            }
            plusDi[i] = 100.0 * plusS[i] / trS[i];
            minusDi[i] = 100.0 * minusS[i] / trS[i];
            double sum = plusDi[i] + minusDi[i];
            dx[i] = sum == 0 ? 0.0 : 100.0 * Math.abs(plusDi[i] - minusDi[i]) / sum;
        }

        double[] adx = new double[n];
        for (int i = 0; i < n; i++) {
            adx[i] = Double.NaN;
            if (i + 1 < period) continue;
            double sum = 0;
            boolean complete = true;
            for (int j = i - period + 1; j <= i; j++) {
                if (Double.isNaN(dx[j])) {
                    complete = false;
                    break;
                }
                sum += dx[j];
            }
            if (complete) adx[i] = sum / period;
        }
        return new Adx(adx, plusDi, minusDi);
    }

    /**
     * Wilder running sum: seeded with the mean of the first window (NaN
     * entries skipped), then s[i] = s[i-1] - s[i-1]/n + x[i].
     */
    static double[] wilder(double[] values, int period) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = Double.NaN;
        if (values.length < period) return out;
        double seed = 0;
        int count = 0;
        for (int i = 0; i < period; i++) {
            if (Double.isNaN(values[i])) continue;
            seed += values[i];
            count++;
        }
        if (count == 0) return out;
        out[period - 1] = seed / count;
        for (int i = period; i < values.length; i++) {
            out[i] = out[i - 1] - out[i - 1] / period + values[i];
        }
        return out;
    }

    public record Adx(double[] adx, double[] plusDi, double[] minusDi) {

        public double lastAdx() {
            return adx[adx.length - 1];
        }

        public double lastPlusDi() {
            return plusDi[plusDi.length - 1];
        }

        public double lastMinusDi() {
            return minusDi[minusDi.length - 1];
        }
    }
}
