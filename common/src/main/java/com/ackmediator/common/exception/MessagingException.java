package com.ackmediator.common.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for the mediator, its pipelines and the log client.
 * Carries an {@link ErrorCode} and a small context map that ends up in the structured log line.
 */
public class MessagingException extends Exception {

    private final ErrorCode errorCode;
    private final Instant timestamp;
    private final Map<String, Object> context;

    public MessagingException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public MessagingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
        this.context = new LinkedHashMap<>();
    }

    public MessagingException withContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getContext() {
        return new LinkedHashMap<>(context);
    }

    public boolean isRetriable() {
        return errorCode.isRetriable();
    }

    public String getCategory() {
        return errorCode.getCategory();
    }

    /**
     * Single-line form used by {@link ExceptionLogger}
     */
    public String getStructuredMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode.name()).append("]");
        sb.append(" code=").append(errorCode.getCode());
        sb.append(", retriable=").append(isRetriable());
        sb.append(", message=").append(getMessage());

        if (!context.isEmpty()) {
            sb.append(", context={");
            context.forEach((k, v) -> sb.append(k).append("=").append(v).append(", "));
            sb.setLength(sb.length() - 2);
            sb.append("}");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return getStructuredMessage();
    }
}
