package com.toolgate.core.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Holds at most one temporary grant per tool.
 * <p>
 * Every read-modify-write of a tool's grant happens under that tool's own lock, so
 * concurrent calls to different tools never contend and N concurrent reservations
 * against K remaining uses succeed exactly {@code min(N, K)} times.
 * <p>
 * When a grant disappears through expiry or exhaustion the tracker remembers why,
 * until a new grant is issued or the lapse is acknowledged. This lets the next prompt
 * for the tool say why the user is being asked again.
 */
@Service
public class PermissionTracker {

    private static final Logger log = LoggerFactory.getLogger(PermissionTracker.class);

    private final Clock clock;
    private final ConcurrentHashMap<String, TemporaryGrant> grants = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Lapse> lapses = new ConcurrentHashMap<>();

    public PermissionTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Replaces any grant for the tool with one valid for {@code duration} from now.
     * A zero or negative duration produces a grant that is already expired.
     */
    public void grantTimeBased(String toolName, Duration duration) {
        Objects.requireNonNull(duration, "duration");
        withLock(toolName, () -> {
            Instant now = clock.instant();
            grants.put(toolName, TemporaryGrant.timeBased(toolName, now, now.plus(duration)));
            lapses.remove(toolName);
            log.debug("Granted {} for {}", toolName, duration);
            return null;
        });
    }

    /**
     * Replaces any grant for the tool with one covering the next {@code count} calls.
     * A count of zero or less leaves the tool without a grant.
     */
    public void grantIterationBased(String toolName, int count) {
        withLock(toolName, () -> {
            lapses.remove(toolName);
            if (count <= 0) {
                grants.remove(toolName);
                log.debug("Iteration grant for {} with count {} leaves no grant", toolName, count);
                return null;
            }
            grants.put(toolName, TemporaryGrant.iterationBased(toolName, clock.instant(), count));
            log.debug("Granted {} for {} iteration(s)", toolName, count);
            return null;
        });
    }

    /**
     * Atomically checks the tool's grant and, for an iteration grant, consumes one use.
     * A time grant is only checked for expiry; its remaining validity is untouched.
     *
     * @return whether the call is covered
     */
    public boolean checkAndReserveIteration(String toolName) {
        return checkGrant(toolName).isGranted();
    }

    /**
     * Single atomic grant check for the decision path. Reserves a use from an iteration
     * grant, tests a time grant for expiry and deletes it once expired, and reports the
     * reason the previous grant lapsed when no grant remains.
     */
    public GrantCheck checkGrant(String toolName) {
        return withLock(toolName, () -> {
            Instant now = clock.instant();
            TemporaryGrant grant = grants.get(toolName);
            if (grant == null) {
                Lapse lapse = lapses.get(toolName);
                return lapse != null ? GrantCheck.lapsed(lapse.reason()) : GrantCheck.noGrant();
            }
            if (grant.kind() == GrantKind.TIME) {
                if (grant.isExpired(now)) {
                    lapse(toolName, grant, ExpirationReason.TIME_EXPIRED);
                    return GrantCheck.lapsed(ExpirationReason.TIME_EXPIRED);
                }
                return GrantCheck.granted(grant);
            }
            if (grant.remainingUses() <= 0) {
                lapse(toolName, grant, ExpirationReason.ITERATIONS_EXHAUSTED);
                return GrantCheck.lapsed(ExpirationReason.ITERATIONS_EXHAUSTED);
            }
            int left = grant.remainingUses() - 1;
            if (left == 0) {
                lapse(toolName, grant, ExpirationReason.ITERATIONS_EXHAUSTED);
            } else {
                grants.put(toolName, grant.withRemainingUses(left));
            }
            log.debug("Reserved iteration for {}, {} left", toolName, left);
            return GrantCheck.granted(grant);
        });
    }

    /**
     * Read-only check: a time grant counts while unexpired, an iteration grant while it has uses.
     */
    public boolean isGranted(String toolName) {
        TemporaryGrant grant = grants.get(toolName);
        return grant != null && grant.isUsable(clock.instant());
    }

    /** The reason the tool's last grant lapsed, if it has not been acknowledged yet. */
    public Optional<ExpirationReason> lapseReason(String toolName) {
        Lapse lapse = lapses.get(toolName);
        return lapse != null ? Optional.of(lapse.reason()) : Optional.empty();
    }

    /**
     * Forgets the lapse reason once the user has been asked again.
     */
    public void acknowledgeLapse(String toolName) {
        lapses.remove(toolName);
    }

    /**
     * Gives back a use consumed by {@link #checkGrant(String)} when the call did not run.
     * Only applies while the grant it was reserved from is still the tool's grant, or
     * when that reservation took its last use and nothing has replaced it since.
     *
     * @param reservedFrom the grant reported in {@link GrantCheck#reserved()}
     * @return whether a use was restored
     */
    public boolean refundIteration(String toolName, TemporaryGrant reservedFrom) {
        if (reservedFrom == null || reservedFrom.kind() != GrantKind.ITERATIONS) {
            return false;
        }
        return withLock(toolName, () -> {
            TemporaryGrant current = grants.get(toolName);
            if (current != null) {
                if (sameIssue(current, reservedFrom)) {
                    grants.put(toolName, current.withRemainingUses(current.remainingUses() + 1));
                    log.debug("Refunded iteration for {}", toolName);
                    return true;
                }
                return false;
            }
            Lapse lapse = lapses.get(toolName);
            if (lapse != null && lapse.reason() == ExpirationReason.ITERATIONS_EXHAUSTED
                    && sameIssue(lapse.grant(), reservedFrom)) {
                grants.put(toolName, reservedFrom.withRemainingUses(1));
                lapses.remove(toolName);
                log.debug("Refunded last iteration for {}", toolName);
                return true;
            }
            return false;
        });
    }

    /**
     * Whether {@link #refundIteration} could still restore a use reserved from {@code reservedFrom}.
     * Once the grant is replaced, revoked or its lapse acknowledged, the answer stays false.
     */
    public boolean isRefundable(String toolName, TemporaryGrant reservedFrom) {
        if (reservedFrom == null || reservedFrom.kind() != GrantKind.ITERATIONS) {
            return false;
        }
        return withLock(toolName, () -> {
            TemporaryGrant current = grants.get(toolName);
            if (current != null) {
                return sameIssue(current, reservedFrom);
            }
            Lapse lapse = lapses.get(toolName);
            return lapse != null && lapse.reason() == ExpirationReason.ITERATIONS_EXHAUSTED
                    && sameIssue(lapse.grant(), reservedFrom);
        });
    }

    public void revoke(String toolName) {
        withLock(toolName, () -> {
            grants.remove(toolName);
            lapses.remove(toolName);
            return null;
        });
    }

    public void revokeAll() {
        for (String toolName : new ArrayList<>(grants.keySet())) {
            revoke(toolName);
        }
        lapses.clear();
    }

    /**
     * Remaining seconds or uses of the tool's grant, empty when it has no usable grant.
     */
    public Optional<GrantStatus> remaining(String toolName) {
        TemporaryGrant grant = grants.get(toolName);
        Instant now = clock.instant();
        if (grant == null || !grant.isUsable(now)) {
            return Optional.empty();
        }
        return Optional.of(statusOf(grant, now));
    }

    /** Snapshot of the usable grants, sorted by tool name. */
    public List<TemporaryGrant> activeGrants() {
        Instant now = clock.instant();
        return grants.values().stream()
                .filter(g -> g.isUsable(now))
                .sorted(Comparator.comparing(TemporaryGrant::toolName))
                .toList();
    }

    public List<GrantStatus> activeGrantStatuses() {
        Instant now = clock.instant();
        return activeGrants().stream().map(g -> statusOf(g, now)).toList();
    }

    /**
     * Purges expired time grants, re-checking each under its tool's lock.
     *
     * @return number of grants removed
     */
    public int cleanupExpired() {
        int removed = 0;
        for (String toolName : new ArrayList<>(grants.keySet())) {
            boolean purged = withLock(toolName, () -> {
                TemporaryGrant grant = grants.get(toolName);
                if (grant != null && grant.isExpired(clock.instant())) {
                    lapse(toolName, grant, ExpirationReason.TIME_EXPIRED);
                    return true;
                }
                return false;
            });
            if (purged) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired grant(s)", removed);
        }
        return removed;
    }

    private void lapse(String toolName, TemporaryGrant grant, ExpirationReason reason) {
        grants.remove(toolName);
        lapses.put(toolName, new Lapse(reason, grant));
        log.debug("Grant for {} lapsed: {}", toolName, reason);
    }

    private static boolean sameIssue(TemporaryGrant a, TemporaryGrant b) {
        return a.kind() == b.kind() && a.grantedAt().equals(b.grantedAt());
    }

    private static GrantStatus statusOf(TemporaryGrant grant, Instant now) {
        if (grant.kind() == GrantKind.TIME) {
            long seconds = Math.max(0, Duration.between(now, grant.expiresAt()).toSeconds());
            return new GrantStatus(grant.toolName(), GrantKind.TIME, seconds, 0);
        }
        return new GrantStatus(grant.toolName(), GrantKind.ITERATIONS, 0, grant.remainingUses());
    }

    private <T> T withLock(String toolName, Supplier<T> action) {
        Objects.requireNonNull(toolName, "toolName");
        ReentrantLock lock = locks.computeIfAbsent(toolName, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private record Lapse(ExpirationReason reason, TemporaryGrant grant) {}
}
