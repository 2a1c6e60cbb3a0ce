package com.oncall.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing investigation MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String DEVICE_NAME = "deviceName";
    public static final String PASS = "pass";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setDevice(String sessionId, String deviceName, int pass) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(DEVICE_NAME, deviceName);
        MDC.put(PASS, String.valueOf(pass));
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(DEVICE_NAME);
        MDC.remove(PASS);
    }
}
