package com.kotsin.grid.protection;

import java.util.Optional;

/**
 * Durable home of the single {@link ProtectionState} record.
 */
public interface ProtectionStateStore {

    Optional<ProtectionState> load();

    /** Replaces the stored record atomically. */
    void save(ProtectionState state);
}
