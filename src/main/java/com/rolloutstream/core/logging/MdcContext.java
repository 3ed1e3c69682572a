package com.rolloutstream.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing log-stream MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRelease(String releaseId) {
        MDC.put("release", releaseId);
    }

    public static void setTarget(String releaseId, String targetId) {
        MDC.put("release", releaseId);
        MDC.put("target", targetId);
    }

    public static void setStream(String releaseId, String targetId, String streamKey) {
        MDC.put("release", releaseId);
        MDC.put("target", targetId);
        MDC.put("streamKey", streamKey);
    }

    public static void clear() {
        MDC.remove("release");
        MDC.remove("target");
        MDC.remove("streamKey");
    }
}
