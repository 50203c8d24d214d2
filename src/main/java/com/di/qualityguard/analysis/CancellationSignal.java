package com.di.qualityguard.analysis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation flag polled between column computations. The analyzer never
 * interrupts running work; it stops scheduling new columns once the signal is raised.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();

    /**
     * @throws AnalysisCancelledException when the signal is raised
     */
    default void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new AnalysisCancelledException("Analysis cancelled during " + stage);
        }
    }

    /** Raised once {@code timeout} has elapsed from now. */
    static CancellationSignal deadline(Duration timeout) {
        return deadline(timeout, Clock.systemUTC());
    }

    static CancellationSignal deadline(Duration timeout, Clock clock) {
        Instant deadline = clock.instant().plus(timeout);
        return () -> !clock.instant().isBefore(deadline);
    }
}
