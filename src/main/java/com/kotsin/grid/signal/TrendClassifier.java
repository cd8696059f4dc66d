package com.kotsin.grid.signal;

import com.kotsin.grid.config.SignalProps;
import com.kotsin.grid.model.KlineBar;

import java.time.Instant;
import java.util.List;

/**
 * EMA alignment plus ADX strength, evaluated on the last bar.
 */
public class TrendClassifier {

    private final SignalProps props;

    public TrendClassifier(SignalProps props) {
        this.props = props;
    }

    public int minimumBars() {
        return props.emaLong() + 50;
    }

    public SignalSnapshot classify(List<KlineBar> bars, Instant at) {
        int n = bars.size();
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        for (int i = 0; i < n; i++) {
            KlineBar b = bars.get(i);
            high[i] = b.getHigh();
            low[i] = b.getLow();
            close[i] = b.getClose();
        }

        double[] emaShort = TrendIndicators.ema(close, props.emaShort());
        double[] emaMedium = TrendIndicators.ema(close, props.emaMedium());
        double[] emaLong = TrendIndicators.ema(close, props.emaLong());
        TrendIndicators.Adx adx = TrendIndicators.adx(high, low, close, props.adxPeriod());

        int last = n - 1;
        double c = close[last];
        double e20 = emaShort[last];
        double e50 = emaMedium[last];
        double e200 = emaLong[last];
        double emaShortSlope = last > 0 ? e20 - emaShort[last - 1] : 0.0;
        double adxValue = Double.isNaN(adx.lastAdx()) ? 0.0 : adx.lastAdx();
        boolean strong = adxValue > props.adxThreshold();

        TrendSignal signal = TrendSignal.RANGING;
        if (c > e200 && e20 > e50 && e50 > e200 && strong && !(emaShortSlope < 0)) {
            signal = TrendSignal.STRONG_UP;
        } else if (c < e200 && e20 < e50 && e50 < e200 && strong && !(emaShortSlope > 0)) {
            signal = TrendSignal.STRONG_DOWN;
        }

        double confidence = 0.0;
        if (signal != TrendSignal.RANGING) {
            double raw = (adxValue - props.adxThreshold()) / props.adxThreshold() * 100.0;
            confidence = Math.min(100.0, Math.max(0.0, raw));
        }

        return SignalSnapshot.builder()
                .signal(signal)
                .close(c)
                .emaShort(e20)
                .emaMedium(e50)
                .emaLong(e200)
                .adx(adxValue)
                .plusDi(Double.isNaN(adx.lastPlusDi()) ? 0.0 : adx.lastPlusDi())
                .minusDi(Double.isNaN(adx.lastMinusDi()) ? 0.0 : adx.lastMinusDi())
                .confidence(confidence)
                .evaluatedAt(at)
                .build();
    }
}
