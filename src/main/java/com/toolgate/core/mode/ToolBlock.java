package com.toolgate.core.mode;

/**
 * Outcome of the mode veto check.
 *
 * @param blocked whether the current mode forbids the call
 * @param reason  message naming the mode, null when not blocked
 */
public record ToolBlock(boolean blocked, String reason) {

    private static final ToolBlock ALLOWED = new ToolBlock(false, null);

    public static ToolBlock allowed() {
        return ALLOWED;
    }

    public static ToolBlock blocked(String reason) {
        return new ToolBlock(true, reason);
    }
}
