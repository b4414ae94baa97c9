package com.toolgate.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setCall puts toolName and callId in MDC")
    void setCall() {
        MdcContext.setCall("bash", "call-42");
        assertEquals("bash", MDC.get("toolName"));
        assertEquals("call-42", MDC.get("callId"));
    }

    @Test
    @DisplayName("clear removes all toolgate MDC keys")
    void clear() {
        MdcContext.setCall("bash", "call-42");
        MdcContext.clear();
        assertNull(MDC.get("toolName"));
        assertNull(MDC.get("callId"));
    }
}
