package com.kotsin.grid.model;

/**
 * Best bid/ask update from the market stream.
 */
public record BookTicker(String symbol, double bid, double ask, long eventTime) {

    public double mid() {
        return (bid + ask) / 2.0;
    }
}
