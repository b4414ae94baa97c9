package com.toolgate.core.mode;

import java.util.List;
import java.util.Locale;

/**
 * Session-wide operating posture. Controls whether writes are allowed at all
 * and whether tool calls are approved without asking.
 */
public enum OperatingMode {
    PLAN(false, true, "Research & planning, read only until approved"),
    NORMAL(false, false, "Ask confirmation before each tool execution"),
    AUTO(true, false, "Auto-approve all tool executions"),
    YOLO(true, false, "Maximum speed, minimal output, auto-approve all"),
    ARCHITECT(false, true, "High-level design focus, read only");

    /** Order followed by {@link ModeManager#cycleMode()}. */
    public static final List<OperatingMode> CYCLE_ORDER = List.of(NORMAL, AUTO, PLAN, YOLO, ARCHITECT);

    private final boolean autoApprove;
    private final boolean readOnly;
    private final String description;

    OperatingMode(boolean autoApprove, boolean readOnly, String description) {
        this.autoApprove = autoApprove;
        this.readOnly = readOnly;
        this.description = description;
    }

    public boolean autoApprove() {
        return autoApprove;
    }

    public boolean readOnly() {
        return readOnly;
    }

    public String description() {
        return description;
    }

    public OperatingMode next() {
        int idx = CYCLE_ORDER.indexOf(this);
        return CYCLE_ORDER.get((idx + 1) % CYCLE_ORDER.size());
    }

    /**
     * Case-insensitive lookup by name, e.g. {@code "plan"}.
     *
     * @throws IllegalArgumentException for an unknown mode name
     */
    public static OperatingMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Mode name is required");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
