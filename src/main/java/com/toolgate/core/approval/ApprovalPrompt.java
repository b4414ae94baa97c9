package com.toolgate.core.approval;

import com.toolgate.core.model.ToolCallRequest;
import com.toolgate.core.model.ToolPermission;
import com.toolgate.core.permission.ExpirationReason;

import java.time.Duration;

/**
 * What the approval collaborator is asked to decide.
 *
 * @param request           the pending tool call
 * @param permissionType    the tool's resolved permission; ask-time and ask-iterations also offer temporary grants
 * @param expirationReason  why an earlier grant for the tool no longer applies, or null
 * @param defaultDuration   duration suggested for a time grant
 * @param defaultIterations count suggested for an iteration grant
 */
public record ApprovalPrompt(
    ToolCallRequest request,
    ToolPermission permissionType,
    ExpirationReason expirationReason,
    Duration defaultDuration,
    int defaultIterations
) {

    public String toolName() {
        return request.toolName();
    }

    public String callId() {
        return request.callId();
    }

    public boolean offersTemporaryGrant() {
        return permissionType.offersTemporaryGrant();
    }

    /** Text shown before the question when an earlier grant lapsed, e.g. "Permission expired: iterations_exhausted". */
    public String expirationNotice() {
        return expirationReason != null ? "Permission expired: " + expirationReason.wireValue() : null;
    }
}
