package com.toolgate.dispatch.api;

import com.toolgate.core.approval.ApprovalGateway;
import com.toolgate.core.approval.ApprovalPrompt;
import com.toolgate.core.approval.ApprovalResponse;
import com.toolgate.core.approval.PendingApprovalRegistry;
import com.toolgate.core.approval.PendingApprovalRegistry.PendingApproval;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Approval queue for serve mode: lists waiting prompts and accepts answers.
 */
@RestController
@RequestMapping("/api/v1/approvals")
@ConditionalOnProperty(name = "toolgate.approval.channel", havingValue = "http")
public class ApprovalController {

    private final PendingApprovalRegistry registry;
    private final ApprovalGateway gateway;

    public ApprovalController(PendingApprovalRegistry registry, ApprovalGateway gateway) {
        this.registry = registry;
        this.gateway = gateway;
    }

    /**
     * GET /api/v1/approvals — Prompts waiting for an answer, oldest first.
     */
    @GetMapping
    public List<Map<String, Object>> list() {
        return registry.list().stream().map(ApprovalController::toJson).toList();
    }

    /**
     * POST /api/v1/approvals/{callId} — Answer a waiting prompt.
     */
    @PostMapping("/{callId}")
    public ResponseEntity<Map<String, Object>> answer(@PathVariable String callId,
                                                      @RequestBody ApprovalAnswerRequest body) {
        var entry = registry.get(callId);
        if (entry.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        ApprovalPrompt prompt = entry.get().prompt();

        ApprovalResponse response;
        try {
            response = toResponse(body, prompt);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (!registry.resolve(callId, response)) {
            return ResponseEntity.status(409).body(Map.of("error", "Approval already resolved", "call_id", callId));
        }
        return ResponseEntity.ok(Map.of("call_id", callId, "response", body.response()));
    }

    /**
     * DELETE /api/v1/approvals/{callId} — Cancel a waiting prompt; the call is skipped.
     */
    @DeleteMapping("/{callId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String callId) {
        if (!gateway.cancel(callId) && !registry.cancel(callId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("call_id", callId, "status", "cancelled"));
    }

    static ApprovalResponse toResponse(ApprovalAnswerRequest body, ApprovalPrompt prompt) {
        if (body.response() == null || body.response().isBlank()) {
            throw new IllegalArgumentException("response is required");
        }
        String kind = body.response().trim().toLowerCase(Locale.ROOT);
        switch (kind) {
            case "yes" -> {
                return new ApprovalResponse.Yes();
            }
            case "no" -> {
                return new ApprovalResponse.No(body.feedback());
            }
            case "always" -> {
                return new ApprovalResponse.Always();
            }
            case "time" -> {
                requireTemporaryGrant(prompt, kind);
                Duration duration = body.durationMinutes() != null
                        ? Duration.ofMinutes(positive(body.durationMinutes(), "duration_minutes"))
                        : prompt.defaultDuration();
                return new ApprovalResponse.YesTime(duration);
            }
            case "iterations" -> {
                requireTemporaryGrant(prompt, kind);
                int count = body.iterations() != null
                        ? positive(body.iterations(), "iterations")
                        : prompt.defaultIterations();
                return new ApprovalResponse.YesIterations(count);
            }
            default -> throw new IllegalArgumentException(
                    "Unknown response '" + body.response() + "'. Must be one of: yes, no, always, time, iterations");
        }
    }

    private static void requireTemporaryGrant(ApprovalPrompt prompt, String kind) {
        if (!prompt.offersTemporaryGrant()) {
            throw new IllegalArgumentException("Response '" + kind + "' is not offered for permission "
                    + prompt.permissionType().configValue());
        }
    }

    private static int positive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }

    private static Map<String, Object> toJson(PendingApproval pending) {
        ApprovalPrompt prompt = pending.prompt();
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("call_id", prompt.callId());
        json.put("tool_name", prompt.toolName());
        json.put("args", prompt.request().args());
        json.put("permission", prompt.permissionType().configValue());
        json.put("offers_temporary_grant", prompt.offersTemporaryGrant());
        if (prompt.expirationReason() != null) {
            json.put("expiration_reason", prompt.expirationReason().wireValue());
        }
        json.put("default_duration_minutes", prompt.defaultDuration().toMinutes());
        json.put("default_iterations", prompt.defaultIterations());
        json.put("requested_at", pending.requestedAt().toString());
        return json;
    }
}
