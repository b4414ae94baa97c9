package com.toolgate.core.mode;

/**
 * Result of a mode transition.
 */
public record ModeChange(OperatingMode previous, OperatingMode current) {

    public boolean changed() {
        return previous != current;
    }
}
