package com.aura.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing the dispatch MDC keys used in structured logging.
 */
public final class MdcContext {

    public static final String DISPATCH_ID = "dispatchId";
    public static final String TARGET_ID = "targetId";
    public static final String METHOD_NAME = "methodName";

    private MdcContext() {}

    public static void setDispatch(String dispatchId, String targetId, String methodName) {
        MDC.put(DISPATCH_ID, dispatchId);
        MDC.put(TARGET_ID, targetId);
        MDC.put(METHOD_NAME, methodName);
    }

    public static void clear() {
        MDC.remove(DISPATCH_ID);
        MDC.remove(TARGET_ID);
        MDC.remove(METHOD_NAME);
    }
}
