package com.syncpipeline.config;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Trace context helper for batch submissions.
 * Puts a per-batch trace id into the MDC and carries the caller's MDC onto worker threads.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String CHUNK_INDEX = "chunkIndex";

    private TraceContextManager() {}

    /**
     * Reuses the caller's trace id when one is set, otherwise starts a new one.
     */
    public static String ensureTraceId() {
        String traceId = MDC.get(TRACE_ID);
        if (traceId == null || traceId.isEmpty()) {
            traceId = generateTraceId();
            MDC.put(TRACE_ID, traceId);
        }
        return traceId;
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Wraps a task so it runs with the MDC captured at wrap time.
     * The executing thread's own MDC is restored afterwards.
     */
    public static <T> Callable<T> propagate(Callable<T> callable) {
        final Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            restore(context);
            try {
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    public static Runnable propagate(Runnable runnable) {
        final Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            restore(context);
            try {
                runnable.run();
            } finally {
                restore(previous);
            }
        };
    }

    public static <T, R> Function<T, R> propagate(Function<T, R> function) {
        final Map<String, String> context = MDC.getCopyOfContextMap();
        return input -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            restore(context);
            try {
                return function.apply(input);
            } finally {
                restore(previous);
            }
        };
    }

    private static void restore(Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        } else {
            MDC.clear();
        }
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(CHUNK_INDEX);
    }
}
