package com.kotsin.grid.broker;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tick and lot filters of one symbol. Rounds to the nearest step.
 */
public record SymbolPrecision(BigDecimal tickSize, BigDecimal stepSize, BigDecimal minQty) {

    public static SymbolPrecision of(String tickSize, String stepSize, String minQty) {
        return new SymbolPrecision(new BigDecimal(tickSize).stripTrailingZeros(),
                new BigDecimal(stepSize).stripTrailingZeros(),
                new BigDecimal(minQty).stripTrailingZeros());
    }

    public double roundPrice(double price) {
        return roundToStep(price, tickSize).doubleValue();
    }

    public double roundQuantity(double quantity) {
        BigDecimal rounded = roundToStep(quantity, stepSize);
        return rounded.max(minQty).doubleValue();
    }

    /** Plain decimal text for request parameters (no exponent). */
    public String formatPrice(double price) {
        return roundToStep(price, tickSize).toPlainString();
    }

    public String formatQuantity(double quantity) {
        return roundToStep(quantity, stepSize).max(minQty).toPlainString();
    }

    private static BigDecimal roundToStep(double value, BigDecimal step) {
        if (step.signum() <= 0) return BigDecimal.valueOf(value);
        BigDecimal steps = BigDecimal.valueOf(value).divide(step, 0, RoundingMode.HALF_UP);
        return steps.multiply(step).setScale(Math.max(step.scale(), 0), RoundingMode.HALF_UP);
    }
}
