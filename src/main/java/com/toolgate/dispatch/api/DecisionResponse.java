package com.toolgate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolgate.core.model.ApprovalDecision;
import com.toolgate.core.model.ToolCallRequest;

public record DecisionResponse(
    @JsonProperty("call_id") String callId,
    @JsonProperty("tool_name") String toolName,
    String verdict,
    String reason,
    String denial
) {

    static DecisionResponse of(ToolCallRequest request, ApprovalDecision decision) {
        return new DecisionResponse(
                request.callId(),
                request.toolName(),
                decision.verdict().name(),
                decision.reason(),
                decision.denial() != null ? decision.denial().name() : null);
    }
}
