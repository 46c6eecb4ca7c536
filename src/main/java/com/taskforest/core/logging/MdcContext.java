package com.taskforest.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for reconstruction logging: {@code workspace}, {@code passId}, {@code taskId}.
 */
public final class MdcContext {

    public static final String WORKSPACE = "workspace";
    public static final String PASS_ID = "passId";
    public static final String TASK_ID = "taskId";

    private MdcContext() {}

    public static void setPass(String workspace, String passId) {
        MDC.put(WORKSPACE, workspace == null ? "" : workspace);
        MDC.put(PASS_ID, passId);
    }

    public static void setTask(String taskId) {
        if (taskId == null) {
            MDC.remove(TASK_ID);
        } else {
            MDC.put(TASK_ID, taskId);
        }
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
    }

    public static void clear() {
        MDC.remove(WORKSPACE);
        MDC.remove(PASS_ID);
        MDC.remove(TASK_ID);
    }
}
