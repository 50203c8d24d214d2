package com.di.qualityguard.analysis;

/**
 * Thrown when an analysis stops because its {@link CancellationSignal} was raised, typically
 * when the request timeout elapsed. Mapped to 408 Request Timeout by
 * {@link com.di.qualityguard.exception.GlobalExceptionHandler}.
 */
public class AnalysisCancelledException extends RuntimeException {

    public AnalysisCancelledException(String message) {
        super(message);
    }
}
