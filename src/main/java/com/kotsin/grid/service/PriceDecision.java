package com.kotsin.grid.service;

/**
 * Result of validating one candidate price.
 */
public record PriceDecision(boolean accepted, double price, String reason) {

    public static PriceDecision accept(double price) {
        return new PriceDecision(true, price, null);
    }

    public static PriceDecision reject(double lastKnown, String reason) {
        return new PriceDecision(false, lastKnown, reason);
    }
}
