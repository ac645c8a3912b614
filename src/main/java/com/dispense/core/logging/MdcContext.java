package com.dispense.core.logging;

import org.slf4j.MDC;

/**
 * Dispense-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setSandbox(String sandboxId) {
        MDC.put("sandboxId", sandboxId);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("sandboxId");
    }
}
