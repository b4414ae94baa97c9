package com.toolgate.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the gatekeeper, consumed by presentation collaborators
 * (mode indicator, approval dialogs, CLI session output).
 *
 * @param eventType event type (e.g. "decision.execute", "grant.issued", "mode.changed")
 * @param toolName  the tool this event relates to (nullable for session-level events)
 * @param callId    the tool call this event relates to (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record GateEvent(
    String eventType,
    String toolName,
    String callId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String DECISION_EXECUTE = "decision.execute";
    public static final String DECISION_SKIP = "decision.skip";
    public static final String APPROVAL_REQUESTED = "approval.requested";
    public static final String GRANT_ISSUED = "grant.issued";
    public static final String POLICY_PERSISTED = "policy.persisted";
    public static final String MODE_CHANGED = "mode.changed";
}
