package com.switchyard.core.logging;

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
    @DisplayName("setSession puts sessionId and sessionName in MDC")
    void setSession() {
        MdcContext.setSession("id-1", "alpha");
        assertEquals("id-1", MDC.get("sessionId"));
        assertEquals("alpha", MDC.get("sessionName"));
    }

    @Test
    @DisplayName("setSession without an id only sets the name")
    void setSessionWithoutId() {
        MdcContext.setSession(null, "alpha");
        assertNull(MDC.get("sessionId"));
        assertEquals("alpha", MDC.get("sessionName"));
    }

    @Test
    @DisplayName("clear removes all switchyard MDC keys")
    void clear() {
        MdcContext.setSession("id-1", "alpha");
        MdcContext.setTerminal("session-alpha-top");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("sessionName"));
        assertNull(MDC.get("terminalId"));
    }
}
