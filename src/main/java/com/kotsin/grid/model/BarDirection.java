package com.kotsin.grid.model;

public enum BarDirection {
    UP,
    DOWN,
    NEUTRAL
}
