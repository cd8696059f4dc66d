package com.kotsin.grid.model;

public enum OrderType {
    LIMIT,
    MARKET
}
