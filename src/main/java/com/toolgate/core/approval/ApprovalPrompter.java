package com.toolgate.core.approval;

import java.util.concurrent.CompletableFuture;

/**
 * Collects an interactive decision from the user.
 * <p>
 * The returned future completes with the user's answer. Cancelling it, or completing it
 * exceptionally, makes the gateway skip the call.
 */
public interface ApprovalPrompter {

    CompletableFuture<ApprovalResponse> requestApproval(ApprovalPrompt prompt);
}
