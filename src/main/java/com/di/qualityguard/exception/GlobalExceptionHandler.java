package com.di.qualityguard.exception;

import com.di.qualityguard.analysis.AnalysisCancelledException;
import com.di.qualityguard.config.MdcRequestFilter;
import com.di.qualityguard.table.InvalidTableException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the controllers to a structured {@link ErrorResponse}.
 *
 * <p>Each handler categorizes the exception with {@link ErrorCategory}, logs it once through
 * SLF4J (the request id comes from the MDC) and answers with the matching HTTP status.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles tables that cannot be analysed (empty upload, bad CSV, ragged rows).
     */
    @ExceptionHandler(InvalidTableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTable(InvalidTableException e) {
        return respond("INVALID_TABLE", e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles missing multipart parts and bad arguments.
     */
    @ExceptionHandler({MissingServletRequestPartException.class,
                       MissingServletRequestParameterException.class,
                       IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        return respond("UPLOAD_TOO_LARGE", e, HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipart(MultipartException e) {
        return respond("MULTIPART_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles analyses stopped by the request deadline.
     */
    @ExceptionHandler(AnalysisCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(AnalysisCancelledException e) {
        return respond("ANALYSIS_CANCELLED", e, HttpStatus.REQUEST_TIMEOUT);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIoException(IOException e) {
        return respond("IO_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Catch-all.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable exception, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        if (status.is5xxServerError()) {
            log.error("[{}] {} [{}]: {}", eventType, exception.getClass().getSimpleName(),
                    category.getName(), exception.getMessage(), exception);
        } else {
            log.warn("[{}] {} [{}]: {}", eventType, exception.getClass().getSimpleName(),
                    category.getName(), exception.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, exception, status));
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(valueOrDefault(MDC.get(MdcRequestFilter.REQUEST_PATH), "/unknown"));
        response.setRequestId(MDC.get(MdcRequestFilter.REQUEST_ID));
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private static String valueOrDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private String requestId;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
