package com.toolgate.core.permission;

import java.time.Instant;

/**
 * A temporary authorization for one tool, bounded by time or by a number of uses.
 * Instances are immutable; consuming a use produces a new grant.
 *
 * @param toolName      the tool covered by this grant
 * @param kind          whether the grant is bounded by time or by use count
 * @param expiresAt     end of validity for {@link GrantKind#TIME} grants, null otherwise
 * @param remainingUses uses left for {@link GrantKind#ITERATIONS} grants, 0 for time grants
 * @param grantedAt     when the user issued the grant
 */
public record TemporaryGrant(
    String toolName,
    GrantKind kind,
    Instant expiresAt,
    int remainingUses,
    Instant grantedAt
) {

    public TemporaryGrant {
        if (remainingUses < 0) {
            throw new IllegalArgumentException("remainingUses must not be negative: " + remainingUses);
        }
    }

    public static TemporaryGrant timeBased(String toolName, Instant grantedAt, Instant expiresAt) {
        return new TemporaryGrant(toolName, GrantKind.TIME, expiresAt, 0, grantedAt);
    }

    public static TemporaryGrant iterationBased(String toolName, Instant grantedAt, int uses) {
        return new TemporaryGrant(toolName, GrantKind.ITERATIONS, null, uses, grantedAt);
    }

    public TemporaryGrant withRemainingUses(int uses) {
        return new TemporaryGrant(toolName, kind, expiresAt, uses, grantedAt);
    }

    public boolean isExpired(Instant now) {
        return kind == GrantKind.TIME && !now.isBefore(expiresAt);
    }

    /** Whether the grant still authorizes a call at {@code now}. */
    public boolean isUsable(Instant now) {
        return switch (kind) {
            case TIME -> now.isBefore(expiresAt);
            case ITERATIONS -> remainingUses > 0;
        };
    }
}
