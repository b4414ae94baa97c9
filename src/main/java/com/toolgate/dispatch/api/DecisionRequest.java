package com.toolgate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/decisions.
 *
 * @param toolName name of the tool the agent wants to call
 * @param args     tool arguments; nullable
 * @param callId   identifier of the call; nullable, generated when absent
 */
public record DecisionRequest(
    @JsonProperty("tool_name") String toolName,
    Map<String, Object> args,
    @JsonProperty("call_id") String callId
) {}
