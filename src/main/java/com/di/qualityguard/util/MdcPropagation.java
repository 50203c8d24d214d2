package com.di.qualityguard.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Carries the submitting thread's SLF4J MDC (e.g. {@code requestId} from
 * {@link com.di.qualityguard.config.MdcRequestFilter}) into column worker threads, so
 * profiler and drift log lines stay correlated with the request that caused them.
 * <p>
 * Usage: {@code CompletableFuture.supplyAsync(MdcPropagation.wrapSupplier(() -> work()), executor)}.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current MDC now and returns a Supplier that installs it around the task,
     * removing the installed keys again in {@code finally}.
     */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.get();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * @return copy of the current thread's MDC; never null
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
