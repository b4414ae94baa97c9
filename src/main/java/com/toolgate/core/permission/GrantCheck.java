package com.toolgate.core.permission;

/**
 * Result of {@link PermissionTracker#checkGrant(String)}.
 *
 * @param status   whether a grant covered the call
 * @param reason   why the previous grant stopped applying, set only for {@link Status#LAPSED}
 * @param reserved the grant a use was reserved from, set only when an iteration was consumed
 */
public record GrantCheck(Status status, ExpirationReason reason, TemporaryGrant reserved) {

    public enum Status { GRANTED, NO_GRANT, LAPSED }

    private static final GrantCheck NO_GRANT = new GrantCheck(Status.NO_GRANT, null, null);

    public static GrantCheck granted(TemporaryGrant reserved) {
        return new GrantCheck(Status.GRANTED, null, reserved);
    }

    public static GrantCheck noGrant() {
        return NO_GRANT;
    }

    public static GrantCheck lapsed(ExpirationReason reason) {
        return new GrantCheck(Status.LAPSED, reason, null);
    }

    public boolean isGranted() {
        return status == Status.GRANTED;
    }

    /** True when an iteration was reserved and could be refunded. */
    public boolean consumedIteration() {
        return reserved != null && reserved.kind() == GrantKind.ITERATIONS;
    }
}
