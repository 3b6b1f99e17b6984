package com.operatorsedge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing dispatch-turn MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTurn(String turnId) {
        MDC.put("turnId", turnId);
    }

    public static void setGear(String gear) {
        MDC.put("gear", gear);
    }

    public static void setJunction(String junctionId) {
        MDC.put("junctionId", junctionId);
    }

    public static void clear() {
        MDC.remove("turnId");
        MDC.remove("gear");
        MDC.remove("junctionId");
    }
}
