package com.di.chunkmutator.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Propagates SLF4J MDC ({@code runId}, {@code migration}) from the orchestrating thread
 * to segment workers so that worker log lines carry the same correlation keys.
 * <p>
 * MDC is thread-local; without propagation, logs from the segment pool would lose the run context.
 * <p>
 * Usage: {@code pool.submit(MdcPropagation.wrapCallable(() -> mutator.mutate(task)));}
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Callable that, when called on another thread,
     * sets that MDC for the duration of the task and clears it in {@code finally}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs the given callable with one extra MDC key set for the duration, removing it afterwards.
     */
    public static <T> T callWithKey(String key, String value, Callable<T> task) throws Exception {
        MDC.put(key, value);
        try {
            return task.call();
        } finally {
            MDC.remove(key);
        }
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
