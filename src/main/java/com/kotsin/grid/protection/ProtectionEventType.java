package com.kotsin.grid.protection;

/**
 * Protection lifecycle events published for monitoring.
 */
public enum ProtectionEventType {
    // Run tracking
    RUN_STARTED,        // New directional run began
    RUN_ENDED,          // Neutral bar reset the run

    // Emergency
    TRIGGERED,          // Flattened and hibernating
    TRIGGER_FAILED,     // Cancel or flatten did not fully succeed

    // Recovery
    RESUMED,            // Hibernation ended, grid trading again
    FORCE_RESET         // Operator cleared protection
}
