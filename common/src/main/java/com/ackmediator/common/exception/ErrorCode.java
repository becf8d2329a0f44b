package com.ackmediator.common.exception;

/**
 * Error codes for the acknowledgement mediator.
 * Grouped by category so logs and alerts can filter on the leading digit.
 */
public enum ErrorCode {

    // ==================== CONSUMER ERRORS (1xxx) ====================
    CONSUMER_SUBSCRIPTION_FAILED(1001, "CONSUMER", "Consumer subscription failed", true),
    CONSUMER_PENDING_QUEUE_FULL(1002, "CONSUMER", "Too many subscribe requests queued during warm-up", true),
    CONSUMER_PIPELINE_TERMINATED(1003, "CONSUMER", "Consumption pipeline already terminated", true),
    CONSUMER_OFFSET_COMMIT_FAILED(1004, "CONSUMER", "Offset commit failed", true),
    CONSUMER_OFFSET_ALREADY_COMMITTED(1005, "CONSUMER", "Commit handle already used", false),

    // ==================== DELIVERY ERRORS (2xxx) ====================
    DELIVERY_UNEXPECTED_REPLY(2001, "DELIVERY", "Subscriber replied with an unexpected signal", false),
    DELIVERY_SUBSCRIBER_FAILED(2002, "DELIVERY", "Subscriber failed while handling the message", false),
    DELIVERY_ATTEMPTS_EXHAUSTED(2003, "DELIVERY", "No acknowledge after all delivery attempts", false),
    DELIVERY_CANCELLED(2004, "DELIVERY", "Delivery cancelled before completion", false),

    // ==================== CODEC ERRORS (3xxx) ====================
    CODEC_DECODE_FAILED(3001, "CODEC", "Message could not be decoded", false),
    CODEC_UNKNOWN_MANIFEST(3002, "CODEC", "No type registered for manifest", false),
    CODEC_ENCODE_FAILED(3003, "CODEC", "Message could not be encoded", false),

    // ==================== PUBLISH ERRORS (4xxx) ====================
    PUBLISH_SEND_FAILED(4001, "PUBLISH", "Log client failed to produce the record", true),
    PUBLISH_ENCODE_FAILED(4002, "PUBLISH", "Outbound message could not be encoded", false),
    PUBLISH_PIPELINE_CLOSED(4003, "PUBLISH", "Publishing pipeline closed", false),

    // ==================== LOG CLIENT ERRORS (5xxx) ====================
    LOG_STREAM_FAILED(5001, "LOG", "Log read stream failed", true),
    LOG_CLIENT_CLOSED(5002, "LOG", "Log client closed", false),

    // ==================== MEDIATOR ERRORS (6xxx) ====================
    MEDIATOR_CLOSED(6001, "MEDIATOR", "Mediator closed", false),
    MEDIATOR_UNKNOWN_COMMAND(6002, "MEDIATOR", "Command type not routable", false),

    // ==================== VALIDATION ERRORS (8xxx) ====================
    VALIDATION_INVALID_SUBSCRIPTION(8001, "VALIDATION", "Invalid subscription settings", false),

    UNKNOWN_ERROR(9999, "UNKNOWN", "Unknown error occurred", true);

    private final int code;
    private final String category;
    private final String description;
    private final boolean retriable;

    ErrorCode(int code, String category, String description, boolean retriable) {
        this.code = code;
        this.category = category;
        this.description = description;
        this.retriable = retriable;
    }

    public int getCode() {
        return code;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetriable() {
        return retriable;
    }

    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN_ERROR;
    }
}
