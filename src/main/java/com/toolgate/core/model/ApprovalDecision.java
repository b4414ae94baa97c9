package com.toolgate.core.model;

/**
 * The gatekeeper's answer for one tool call.
 *
 * @param verdict whether the call may run
 * @param reason  human-readable reason
 * @param denial  category of the denial when {@code verdict} is {@link Verdict#SKIP}
 */
public record ApprovalDecision(
    Verdict verdict,
    String reason,
    DenialKind denial
) {

    public static final String DENIED = "denied";
    public static final String DECLINED = "declined";
    public static final String APPROVAL_CANCELLED = "approval_cancelled";
    public static final String APPROVAL_TIMEOUT = "approval_timeout";
    public static final String UNKNOWN_TOOL = "unknown_tool";

    public enum Verdict { EXECUTE, SKIP }

    public static ApprovalDecision execute(String reason) {
        return new ApprovalDecision(Verdict.EXECUTE, reason, null);
    }

    public static ApprovalDecision skip(DenialKind denial, String reason) {
        return new ApprovalDecision(Verdict.SKIP, reason, denial);
    }

    public static ApprovalDecision denied() {
        return skip(DenialKind.PERMISSION_DENIED, DENIED);
    }

    public static ApprovalDecision declined() {
        return skip(DenialKind.APPROVAL_DECLINED, DECLINED);
    }

    public static ApprovalDecision cancelled() {
        return skip(DenialKind.APPROVAL_CANCELLED, APPROVAL_CANCELLED);
    }

    public static ApprovalDecision timedOut() {
        return skip(DenialKind.APPROVAL_TIMEOUT, APPROVAL_TIMEOUT);
    }

    public boolean isExecute() {
        return verdict == Verdict.EXECUTE;
    }
}
