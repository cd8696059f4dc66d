package com.kotsin.grid.support;

import com.kotsin.grid.protection.ProtectionState;
import com.kotsin.grid.protection.ProtectionStateStore;

import java.util.Optional;

public class InMemoryProtectionStateStore implements ProtectionStateStore {

    private ProtectionState stored;
    private int saves;

    public InMemoryProtectionStateStore() {
    }

    public InMemoryProtectionStateStore(ProtectionState initial) {
        this.stored = initial;
    }

    @Override
    public synchronized Optional<ProtectionState> load() {
        return Optional.ofNullable(stored).map(ProtectionState::copy);
    }

    @Override
    public synchronized void save(ProtectionState state) {
        stored = state.copy();
        saves++;
    }

    public synchronized ProtectionState stored() {
        return stored;
    }

    public synchronized int saves() {
        return saves;
    }
}
