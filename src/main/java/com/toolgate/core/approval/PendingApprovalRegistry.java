package com.toolgate.core.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Approval channel for serve mode: prompts wait here until a client answers them
 * through the REST API.
 */
@Component
@ConditionalOnProperty(name = "toolgate.approval.channel", havingValue = "http")
public class PendingApprovalRegistry implements ApprovalPrompter {

    private static final Logger log = LoggerFactory.getLogger(PendingApprovalRegistry.class);

    private final ConcurrentHashMap<String, PendingApproval> pending = new ConcurrentHashMap<>();

    /**
     * A prompt waiting for an answer.
     *
     * @param prompt      what the user is asked
     * @param requestedAt when the prompt was queued
     * @param future      completed with the user's answer
     */
    public record PendingApproval(ApprovalPrompt prompt, Instant requestedAt,
                                  CompletableFuture<ApprovalResponse> future) {}

    @Override
    public CompletableFuture<ApprovalResponse> requestApproval(ApprovalPrompt prompt) {
        CompletableFuture<ApprovalResponse> future = new CompletableFuture<>();
        PendingApproval entry = new PendingApproval(prompt, Instant.now(), future);
        pending.put(prompt.callId(), entry);
        future.whenComplete((answer, error) -> pending.remove(prompt.callId(), entry));
        log.info("Queued approval for {} ({})", prompt.toolName(), prompt.callId());
        return future;
    }

    /** Waiting prompts, oldest first. */
    public List<PendingApproval> list() {
        return pending.values().stream()
                .sorted(Comparator.comparing(PendingApproval::requestedAt))
                .toList();
    }

    public Optional<PendingApproval> get(String callId) {
        return Optional.ofNullable(pending.get(callId));
    }

    /**
     * Answers a waiting prompt.
     *
     * @return false if no prompt is waiting under the call id
     */
    public boolean resolve(String callId, ApprovalResponse response) {
        PendingApproval entry = pending.get(callId);
        if (entry == null) {
            return false;
        }
        log.info("Approval for {} ({}) answered: {}", entry.prompt().toolName(), callId,
                response.getClass().getSimpleName());
        return entry.future().complete(response);
    }

    public boolean cancel(String callId) {
        PendingApproval entry = pending.get(callId);
        return entry != null && entry.future().cancel(true);
    }
}
