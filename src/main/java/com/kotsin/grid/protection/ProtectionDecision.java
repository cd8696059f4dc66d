package com.kotsin.grid.protection;

/**
 * Outcome of a protection check on a price tick.
 */
public enum ProtectionDecision {
    /** Normal state, grid may adjust. */
    PROCEED,
    /** Hibernating; grid work suppressed. */
    HIBERNATING,
    /** Flattened and now hibernating. */
    TRIGGERED,
    /** Threshold crossed but the sequence did not complete; protection stays off, grid suppressed. */
    TRIGGER_FAILED,
    /** Still extreme while an attempt runs or inside the retry cooldown; grid suppressed. */
    EXTREME_COOLDOWN,
    /** Hibernation just ended; positions and orders need a fresh sync. */
    RESUMED
}
