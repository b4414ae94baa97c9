package com.toolgate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A single tool invocation the agent wants to perform.
 *
 * @param toolName name of the tool being invoked
 * @param args     tool arguments as decoded from the model's function call
 * @param callId   identifier of this invocation attempt
 */
public record ToolCallRequest(
    String toolName,
    Map<String, Object> args,
    String callId
) {

    public ToolCallRequest {
        // decoded JSON arguments may hold null values
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
        if (callId == null || callId.isBlank()) {
            callId = UUID.randomUUID().toString();
        }
    }

    public static ToolCallRequest of(String toolName, Map<String, Object> args) {
        return new ToolCallRequest(toolName, args, null);
    }
}
