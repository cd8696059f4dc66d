package com.kotsin.grid.model;

public enum OrderSide {
    BUY,
    SELL
}
