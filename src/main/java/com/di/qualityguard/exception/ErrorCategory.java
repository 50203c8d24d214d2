package com.di.qualityguard.exception;

import com.di.qualityguard.analysis.AnalysisCancelledException;
import com.di.qualityguard.table.InvalidTableException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for error responses and log lines.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    INVALID_INPUT("Invalid input", "Uploaded table is empty, malformed, or inconsistent"),
    VALIDATION_ERROR("Validation error", "Request parameter or argument validation failed"),
    UPLOAD_TOO_LARGE("Upload too large", "Uploaded file exceeds the configured size limit"),
    TIMEOUT_ERROR("Timeout error", "Analysis exceeded its time budget and was cancelled"),
    IO_ERROR("I/O error", "Failure reading the request or upload stream"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof InvalidTableException, INVALID_INPUT);
        MATCHERS.put(ErrorCategory::isUploadTooLarge, UPLOAD_TOO_LARGE);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(t -> t instanceof java.io.IOException, IO_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isUploadTooLarge(Throwable t) {
        return t instanceof org.springframework.web.multipart.MaxUploadSizeExceededException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof AnalysisCancelledException
                || t instanceof java.util.concurrent.TimeoutException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof org.springframework.web.multipart.support.MissingServletRequestPartException
                || t instanceof org.springframework.web.bind.MissingServletRequestParameterException
                || t instanceof org.springframework.web.multipart.MultipartException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || t instanceof java.util.concurrent.RejectedExecutionException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException;
    }
}
