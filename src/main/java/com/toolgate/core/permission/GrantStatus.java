package com.toolgate.core.permission;

/**
 * Display view of a live grant.
 *
 * @param toolName         the tool covered
 * @param kind             time- or use-bounded
 * @param remainingSeconds seconds left for time grants, 0 otherwise
 * @param remainingUses    uses left for iteration grants, 0 otherwise
 */
public record GrantStatus(String toolName, GrantKind kind, long remainingSeconds, int remainingUses) {

    public String describe() {
        if (kind == GrantKind.TIME) {
            return remainingSeconds + "s remaining";
        }
        return remainingUses + (remainingUses == 1 ? " use remaining" : " uses remaining");
    }
}
