package com.sectune.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sectune-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(long jobId) {
        MDC.put("jobId", String.valueOf(jobId));
    }

    public static void setConversation(String conversationId) {
        MDC.put("conversationId", conversationId);
    }

    public static void setModel(String modelId) {
        MDC.put("modelId", modelId);
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("conversationId");
        MDC.remove("modelId");
    }
}
