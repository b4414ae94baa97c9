package com.toolgate.core.approval;

import java.time.Duration;

/**
 * The user's answer to an approval prompt.
 */
public sealed interface ApprovalResponse
        permits ApprovalResponse.Yes, ApprovalResponse.No, ApprovalResponse.Always,
                ApprovalResponse.YesTime, ApprovalResponse.YesIterations {

    /** Run this call once. */
    record Yes() implements ApprovalResponse {}

    /**
     * Do not run this call.
     *
     * @param feedback optional note from the user for the agent, may be null
     */
    record No(String feedback) implements ApprovalResponse {}

    /** Run this call and every later call of the tool; persisted to the policy file. */
    record Always() implements ApprovalResponse {}

    /** Run this call and any call of the tool for the given duration. */
    record YesTime(Duration duration) implements ApprovalResponse {}

    /** Run this call and the next {@code count} calls of the tool. */
    record YesIterations(int count) implements ApprovalResponse {}

    static ApprovalResponse yes() {
        return new Yes();
    }

    static ApprovalResponse no() {
        return new No(null);
    }

    static ApprovalResponse always() {
        return new Always();
    }
}
