package com.toolgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing gatekeeper-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setCall(String toolName, String callId) {
        MDC.put("toolName", toolName);
        MDC.put("callId", callId);
    }

    public static void clear() {
        MDC.remove("toolName");
        MDC.remove("callId");
    }
}
