package com.toolgate.core.permission;

/**
 * Why a temporary grant stopped covering a tool. The wire value is shown to the user
 * verbatim when they are asked again.
 */
public enum ExpirationReason {
    TIME_EXPIRED("time_expired"),
    ITERATIONS_EXHAUSTED("iterations_exhausted");

    private final String wireValue;

    ExpirationReason(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
