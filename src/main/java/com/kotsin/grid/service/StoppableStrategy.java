package com.kotsin.grid.service;

/**
 * Anything the shutdown sequence must stop. Implementations without work
 * to do still implement it as a no-op.
 */
public interface StoppableStrategy {

    String name();

    void stop();
}
