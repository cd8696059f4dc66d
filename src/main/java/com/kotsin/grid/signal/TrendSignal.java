package com.kotsin.grid.signal;

public enum TrendSignal {
    STRONG_UP,
    STRONG_DOWN,
    RANGING
}
