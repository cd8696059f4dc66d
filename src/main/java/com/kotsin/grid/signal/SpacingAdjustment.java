package com.kotsin.grid.signal;

/**
 * Multipliers applied to the four current spacings. Widening the side that
 * trades against the trend slows its fills.
 */
public record SpacingAdjustment(double longGridMultiplier,
                                double longProfitMultiplier,
                                double shortGridMultiplier,
                                double shortProfitMultiplier) {

    public static final SpacingAdjustment NEUTRAL = new SpacingAdjustment(1.0, 1.0, 1.0, 1.0);

    public static SpacingAdjustment forSignal(TrendSignal signal) {
        return switch (signal) {
            case STRONG_UP -> new SpacingAdjustment(1.0, 1.0, 2.0, 2.0);
            case STRONG_DOWN -> new SpacingAdjustment(2.0, 2.0, 1.0, 1.0);
            case RANGING -> NEUTRAL;
        };
    }
}
