package com.contextbus.logging;

import org.slf4j.MDC;

/**
 * MDC keys for orchestration logging. Worker threads set them on entry and
 * clear them on exit; pooled threads never inherit a previous task's keys.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String JOB_KEY = "jobKey";
    public static final String PHASE = "phase";
    public static final String TASK_ID = "taskId";

    private MdcContext() {}

    public static void setSession(String sessionId, String jobKey) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(JOB_KEY, jobKey);
    }

    public static void setPhase(String sessionId, String phase) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(PHASE, phase);
    }

    public static void setTask(String sessionId, String phase, String taskId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(PHASE, phase);
        MDC.put(TASK_ID, taskId);
    }

    public static void clearPhase() {
        MDC.remove(PHASE);
        MDC.remove(TASK_ID);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(JOB_KEY);
        MDC.remove(PHASE);
        MDC.remove(TASK_ID);
    }
}
