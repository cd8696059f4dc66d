package com.kotsin.grid.model;

import java.util.Locale;

/**
 * Exchange order lifecycle states as seen by the grid.
 */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    EXPIRED,
    REJECTED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == EXPIRED || this == REJECTED;
    }

    public static OrderStatus fromExchange(String raw) {
        if (raw == null) return UNKNOWN;
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "NEW":
                return NEW;
            case "PARTIALLY_FILLED":
                return PARTIALLY_FILLED;
            case "FILLED":
                return FILLED;
            case "CANCELED":
            case "CANCELLED":
                return CANCELED;
            case "EXPIRED":
            case "EXPIRED_IN_MATCH":
                return EXPIRED;
            case "REJECTED":
                return REJECTED;
            default:
                return UNKNOWN;
        }
    }
}
