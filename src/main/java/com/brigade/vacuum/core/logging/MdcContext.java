package com.brigade.vacuum.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing vacuum-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPass(String passId) {
        MDC.put("passId", passId);
    }

    public static void setPolicy(String passId, String policy) {
        MDC.put("passId", passId);
        MDC.put("policy", policy);
    }

    public static void setBuild(String buildId) {
        MDC.put("buildId", buildId);
    }

    public static void clearBuild() {
        MDC.remove("buildId");
    }

    public static void clear() {
        MDC.remove("passId");
        MDC.remove("policy");
        MDC.remove("buildId");
    }
}
