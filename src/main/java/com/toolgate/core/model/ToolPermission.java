package com.toolgate.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Static permission configured for a tool.
 */
public enum ToolPermission {
    ALWAYS("always"),
    NEVER("never"),
    ASK("ask"),
    ASK_TIME("ask-time"),
    ASK_ITERATIONS("ask-iterations");

    private final String configValue;

    ToolPermission(String configValue) {
        this.configValue = configValue;
    }

    /** The value written to and read from the policy file. */
    public String configValue() {
        return configValue;
    }

    public boolean offersTemporaryGrant() {
        return this == ASK_TIME || this == ASK_ITERATIONS;
    }

    /**
     * Parses a configuration value. Case-insensitive; underscores and hyphens are interchangeable.
     *
     * @throws InvalidPermissionException if the value names no permission
     */
    public static ToolPermission fromConfig(String value) {
        if (value == null) {
            throw new InvalidPermissionException("Tool permission must not be null. Must be one of: " + validValues());
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ToolPermission permission : values()) {
            if (permission.configValue.equals(normalized)) {
                return permission;
            }
        }
        throw new InvalidPermissionException(
                "Invalid tool permission '" + value + "'. Must be one of: " + validValues());
    }

    private static String validValues() {
        return Arrays.stream(values())
                .map(ToolPermission::configValue)
                .collect(Collectors.joining(", "));
    }
}
