package com.di.silverline.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries SLF4J MDC ({@link #RUN_ID}, {@link #TABLE}, {@link #LOGICAL_DATE}) from the submitting thread to
 * worker threads, so per-table and per-step logs stay correlated with their run.
 * <p>
 * MDC is thread-local; tasks handed to an {@code ExecutorService} start with an empty context unless wrapped:
 * {@code executor.submit(MdcPropagation.wrapCallable(() -> processTable(t)));}
 */
public final class MdcPropagation {

    public static final String RUN_ID = "runId";
    public static final String TABLE = "table";
    public static final String LOGICAL_DATE = "logicalDate";

    private MdcPropagation() {
    }

    /**
     * Captures the current MDC; the returned Callable installs it while running and restores the
     * worker's previous context afterwards.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> captured = copyMdc();
        return () -> {
            Map<String, String> previous = copyMdc();
            setMdc(captured);
            try {
                return task.call();
            } finally {
                setMdc(previous);
            }
        };
    }

    /**
     * Snapshot of the current thread's MDC; never null.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map != null ? map : Collections.emptyMap();
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(contextMap);
        }
    }
}
