package com.di.qualityguard.analysis;

import com.di.qualityguard.util.MdcPropagation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.IntFunction;

/**
 * Fan-out/fan-in over columns: one task per column on the shared pool, results collected by
 * column position. Tasks are expected to handle their own per-column failures; the only
 * exception that normally escapes is {@link AnalysisCancelledException}.
 */
public class ColumnTaskRunner {

    private final Executor executor;

    public ColumnTaskRunner(Executor executor) {
        this.executor = executor;
    }

    /**
     * Runs {@code task.apply(i)} for every {@code i} in {@code [0, count)}. The signal is checked
     * as each task starts, so a raised signal stops columns that have not begun yet.
     *
     * @return results, element {@code i} belonging to column {@code i}
     */
    public <T> List<T> runAll(String stage, int count, IntFunction<T> task, CancellationSignal cancellation) {
        List<CompletableFuture<T>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final int index = i;
            futures.add(CompletableFuture.supplyAsync(MdcPropagation.wrapSupplier(() -> {
                cancellation.throwIfCancelled(stage);
                return task.apply(index);
            }), executor));
        }

        List<T> results = new ArrayList<>(count);
        try {
            for (CompletableFuture<T> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(false));
            throw new AnalysisCancelledException("Interrupted during " + stage);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(false));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(stage + " failed", cause);
        }
        return results;
    }
}
