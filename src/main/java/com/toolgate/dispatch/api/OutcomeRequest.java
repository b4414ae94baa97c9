package com.toolgate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/decisions/{callId}/outcome.
 *
 * @param toolName  the tool that was executed
 * @param succeeded whether the execution completed successfully
 */
public record OutcomeRequest(
    @JsonProperty("tool_name") String toolName,
    boolean succeeded
) {}
