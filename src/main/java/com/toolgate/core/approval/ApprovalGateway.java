package com.toolgate.core.approval;

import com.toolgate.core.config.ToolgateProperties;
import com.toolgate.core.events.EventBus;
import com.toolgate.core.events.GateEvent;
import com.toolgate.core.logging.MdcContext;
import com.toolgate.core.mode.ModeManager;
import com.toolgate.core.mode.ToolBlock;
import com.toolgate.core.model.ApprovalDecision;
import com.toolgate.core.model.DenialKind;
import com.toolgate.core.model.ToolCallRequest;
import com.toolgate.core.model.ToolPermission;
import com.toolgate.core.permission.ExpirationReason;
import com.toolgate.core.permission.GrantCheck;
import com.toolgate.core.permission.PermissionTracker;
import com.toolgate.core.permission.TemporaryGrant;
import com.toolgate.core.policy.PermissionPolicy;
import com.toolgate.core.policy.PolicyPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a tool call may run now.
 * <p>
 * The checks run in a fixed order: mode veto, temporary grant, static policy
 * (deny/allow globs, then the configured permission), mode auto-approval, and finally
 * the interactive approval collaborator. The returned future never completes
 * exceptionally; every failure resolves to a skip.
 */
@Service
public class ApprovalGateway {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGateway.class);

    private final ModeManager modeManager;
    private final PermissionTracker tracker;
    private final PermissionPolicy policy;
    private final ApprovalPrompter prompter;
    private final EventBus eventBus;
    private final ToolgateProperties properties;

    /** In-flight approval requests, keyed by call id. */
    private final ConcurrentHashMap<String, CompletableFuture<ApprovalResponse>> pending = new ConcurrentHashMap<>();

    /**
     * Iteration reservations that may be refunded through {@link #reportOutcome}. Entries whose
     * grant can no longer be refunded are pruned, so unreported calls do not accumulate.
     */
    private final ConcurrentHashMap<String, TemporaryGrant> reservations = new ConcurrentHashMap<>();

    @Autowired
    public ApprovalGateway(ModeManager modeManager,
                           PermissionTracker tracker,
                           PermissionPolicy policy,
                           ObjectProvider<ApprovalPrompter> prompter,
                           EventBus eventBus,
                           ToolgateProperties properties) {
        this(modeManager, tracker, policy, prompter.getIfAvailable(), eventBus, properties);
    }

    public ApprovalGateway(ModeManager modeManager,
                           PermissionTracker tracker,
                           PermissionPolicy policy,
                           ApprovalPrompter prompter,
                           EventBus eventBus,
                           ToolgateProperties properties) {
        this.modeManager = modeManager;
        this.tracker = tracker;
        this.policy = policy;
        this.prompter = prompter;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    /**
     * Evaluates a tool call. Completes immediately unless the user has to be asked.
     */
    public CompletableFuture<ApprovalDecision> evaluate(ToolCallRequest request) {
        if (request == null || request.toolName() == null || request.toolName().isBlank()) {
            ApprovalDecision decision = ApprovalDecision.skip(DenialKind.UNKNOWN_TOOL, ApprovalDecision.UNKNOWN_TOOL);
            log.info("Tool call without a tool name: SKIP ({})", decision.reason());
            return CompletableFuture.completedFuture(decision);
        }

        MdcContext.setCall(request.toolName(), request.callId());
        try {
            return evaluateChecked(request);
        } catch (Exception e) {
            log.error("Unexpected failure evaluating {}: {}", request.toolName(), e.getMessage(), e);
            return CompletableFuture.completedFuture(finish(request, ApprovalDecision.denied()));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Blocking form of {@link #evaluate(ToolCallRequest)}.
     */
    public ApprovalDecision decide(ToolCallRequest request) {
        return evaluate(request).join();
    }

    /**
     * Cancels an in-flight approval; the call resolves to {@code approval_cancelled}.
     *
     * @return whether a pending approval existed for the call id
     */
    public boolean cancel(String callId) {
        CompletableFuture<ApprovalResponse> future = pending.get(callId);
        if (future == null) {
            return false;
        }
        log.info("Cancelling approval for call {}", callId);
        return future.cancel(true);
    }

    public Set<String> pendingCallIds() {
        return Set.copyOf(pending.keySet());
    }

    /**
     * Reports whether an executed call actually succeeded. With
     * {@code toolgate.grants.refund-on-failure} enabled, a failed or cancelled call gives
     * back the grant use it consumed.
     */
    public void reportOutcome(ToolCallRequest request, boolean succeeded) {
        TemporaryGrant reservedFrom = reservations.remove(request.callId());
        if (reservedFrom == null || succeeded) {
            return;
        }
        if (tracker.refundIteration(request.toolName(), reservedFrom)) {
            log.info("Refunded grant use for {} after failed call {}", request.toolName(), request.callId());
        }
    }

    /**
     * Drops reservations whose grant was replaced, revoked or has lapsed for good.
     *
     * @return number of reservations removed
     */
    @Scheduled(fixedDelayString = "#{@toolgateProperties.grants.sweepIntervalMs}")
    public int pruneReservations() {
        int before = reservations.size();
        reservations.entrySet().removeIf(e -> !tracker.isRefundable(e.getValue().toolName(), e.getValue()));
        int removed = before - reservations.size();
        if (removed > 0) {
            log.debug("Dropped {} stale grant reservation(s)", removed);
        }
        return removed;
    }

    int reservationCount() {
        return reservations.size();
    }

    private CompletableFuture<ApprovalDecision> evaluateChecked(ToolCallRequest request) {
        String toolName = request.toolName();

        ToolBlock block = modeManager.shouldBlockTool(toolName, request.args());
        if (block.blocked()) {
            return done(request, ApprovalDecision.skip(DenialKind.MODE_VETO, block.reason()));
        }

        GrantCheck grant = tracker.checkGrant(toolName);
        if (grant.isGranted()) {
            if (grant.consumedIteration() && properties.getGrants().isRefundOnFailure()) {
                pruneReservations();
                reservations.put(request.callId(), grant.reserved());
            }
            return done(request, ApprovalDecision.execute("granted"));
        }
        ExpirationReason expiration = grant.status() == GrantCheck.Status.LAPSED ? grant.reason() : null;

        ToolPermission permission = policy.resolve(toolName, request.args());
        log.debug("Resolved permission for {}: {}", toolName, permission.configValue());
        if (permission == ToolPermission.ALWAYS) {
            return done(request, ApprovalDecision.execute("always"));
        }
        if (permission == ToolPermission.NEVER) {
            return done(request, ApprovalDecision.denied());
        }

        if (modeManager.shouldAutoApprove(toolName)) {
            return done(request, ApprovalDecision.execute("auto_approved"));
        }

        return askUser(request, permission, expiration);
    }

    private CompletableFuture<ApprovalDecision> askUser(ToolCallRequest request,
                                                       ToolPermission permission,
                                                       ExpirationReason expiration) {
        if (prompter == null) {
            log.warn("No approval channel configured; cannot ask about {}", request.toolName());
            return done(request, ApprovalDecision.cancelled());
        }

        ApprovalPrompt prompt = new ApprovalPrompt(request, permission, expiration,
                properties.getApproval().getDefaultDuration(),
                properties.getApproval().getDefaultIterations());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("permission", permission.configValue());
        if (expiration != null) {
            payload.put("expirationReason", expiration.wireValue());
        }
        eventBus.publish(new GateEvent(GateEvent.APPROVAL_REQUESTED, request.toolName(), request.callId(),
                payload, Instant.now()));

        CompletableFuture<ApprovalResponse> response;
        try {
            response = prompter.requestApproval(prompt);
        } catch (RuntimeException e) {
            log.warn("Approval channel failed for {}: {}", request.toolName(), e.getMessage());
            return done(request, ApprovalDecision.cancelled());
        }
        if (response == null) {
            log.warn("Approval channel returned no answer for {}", request.toolName());
            return done(request, ApprovalDecision.cancelled());
        }
        pending.put(request.callId(), response);

        Duration timeout = properties.getApproval().getTimeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            response.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return response.handle((answer, error) -> {
            pending.remove(request.callId(), response);
            MdcContext.setCall(request.toolName(), request.callId());
            try {
                if (error != null) {
                    return finish(request, failureDecision(request, error));
                }
                return finish(request, applyResponse(request, permission, answer));
            } catch (Exception e) {
                log.error("Unexpected failure applying approval for {}: {}", request.toolName(), e.getMessage(), e);
                return finish(request, ApprovalDecision.denied());
            } finally {
                MdcContext.clear();
            }
        });
    }

    private ApprovalDecision applyResponse(ToolCallRequest request, ToolPermission permission, ApprovalResponse answer) {
        String toolName = request.toolName();
        tracker.acknowledgeLapse(toolName);

        if (answer == null) {
            log.warn("Approval channel completed without an answer for {}", toolName);
            return ApprovalDecision.cancelled();
        }
        if (answer instanceof ApprovalResponse.Yes) {
            return ApprovalDecision.execute("approved");
        }
        if (answer instanceof ApprovalResponse.No no) {
            if (no.feedback() != null && !no.feedback().isBlank()) {
                return ApprovalDecision.skip(DenialKind.APPROVAL_DECLINED,
                        ApprovalDecision.DECLINED + ": " + no.feedback().trim());
            }
            return ApprovalDecision.declined();
        }
        if (answer instanceof ApprovalResponse.Always) {
            tracker.revoke(toolName);
            try {
                policy.persistAlways(toolName);
            } catch (PolicyPersistenceException e) {
                log.warn("{}; running the approved call anyway", e.getMessage());
            }
            return ApprovalDecision.execute("approved_always");
        }
        if (!permission.offersTemporaryGrant()) {
            log.warn("Temporary grant answer for {} whose permission is {}; running once without a grant",
                    toolName, permission.configValue());
            return ApprovalDecision.execute("approved");
        }
        if (answer instanceof ApprovalResponse.YesTime time) {
            Duration duration = time.duration() != null ? time.duration() : properties.getApproval().getDefaultDuration();
            tracker.grantTimeBased(toolName, duration);
            publishGrant(request, Map.of("kind", "time", "seconds", duration.toSeconds()));
            return ApprovalDecision.execute("granted_time");
        }
        if (answer instanceof ApprovalResponse.YesIterations iterations) {
            tracker.grantIterationBased(toolName, iterations.count());
            publishGrant(request, Map.of("kind", "iterations", "count", iterations.count()));
            return ApprovalDecision.execute("granted_iterations");
        }
        log.warn("Unrecognized approval answer for {}: {}", toolName, answer);
        return ApprovalDecision.cancelled();
    }

    private ApprovalDecision failureDecision(ToolCallRequest request, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("Approval for {} timed out", request.toolName());
            return ApprovalDecision.timedOut();
        }
        if (cause instanceof CancellationException) {
            log.info("Approval for {} was cancelled", request.toolName());
            return ApprovalDecision.cancelled();
        }
        log.warn("Approval channel failed for {}: {}", request.toolName(), cause.getMessage());
        return ApprovalDecision.cancelled();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void publishGrant(ToolCallRequest request, Map<String, Object> payload) {
        eventBus.publish(new GateEvent(GateEvent.GRANT_ISSUED, request.toolName(), request.callId(),
                payload, Instant.now()));
    }

    private CompletableFuture<ApprovalDecision> done(ToolCallRequest request, ApprovalDecision decision) {
        return CompletableFuture.completedFuture(finish(request, decision));
    }

    private ApprovalDecision finish(ToolCallRequest request, ApprovalDecision decision) {
        if (decision.isExecute()) {
            log.info("Tool {} ({}): EXECUTE [{}]", request.toolName(), request.callId(), decision.reason());
        } else {
            log.info("Tool {} ({}): SKIP [{}] {}", request.toolName(), request.callId(),
                    decision.denial(), decision.reason());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        if (decision.reason() != null) {
            payload.put("reason", decision.reason());
        }
        if (decision.denial() != null) {
            payload.put("denial", decision.denial().name());
        }
        eventBus.publish(new GateEvent(
                decision.isExecute() ? GateEvent.DECISION_EXECUTE : GateEvent.DECISION_SKIP,
                request.toolName(), request.callId(), payload, Instant.now()));
        return decision;
    }
}
