package com.switchyard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Switchyard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId, String sessionName) {
        if (sessionId != null) {
            MDC.put("sessionId", sessionId);
        }
        MDC.put("sessionName", sessionName);
    }

    public static void setTerminal(String terminalId) {
        MDC.put("terminalId", terminalId);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("sessionName");
        MDC.remove("terminalId");
    }
}
