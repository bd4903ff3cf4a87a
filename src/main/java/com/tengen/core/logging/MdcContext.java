package com.tengen.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tengen-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String LOAD_ID = "loadId";
    public static final String STAGE = "stage";
    public static final String GTP_COMMAND = "gtpCommand";

    private MdcContext() {}

    public static void setLoad(String loadId) {
        MDC.put(LOAD_ID, loadId);
    }

    public static void setStage(String loadId, String stage) {
        MDC.put(LOAD_ID, loadId);
        MDC.put(STAGE, stage);
    }

    public static void setCommand(String verb) {
        MDC.put(GTP_COMMAND, verb);
    }

    public static void clearCommand() {
        MDC.remove(GTP_COMMAND);
    }

    /** Removes the load keys, leaving keys set by the caller in place. */
    public static void clearLoad() {
        MDC.remove(LOAD_ID);
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(LOAD_ID);
        MDC.remove(STAGE);
        MDC.remove(GTP_COMMAND);
    }
}
