package com.toolgate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/approvals/{callId}.
 *
 * @param response        yes, no, always, time or iterations
 * @param durationMinutes length of a time grant; nullable, defaults to the configured duration
 * @param iterations      size of an iteration grant; nullable, defaults to the configured count
 * @param feedback        note for the agent when declining; nullable
 */
public record ApprovalAnswerRequest(
    String response,
    @JsonProperty("duration_minutes") Integer durationMinutes,
    Integer iterations,
    String feedback
) {}
