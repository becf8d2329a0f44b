package com.ackmediator.common.exception;

/**
 * Failure to publish one message to a topic
 */
public class PublishException extends MessagingException {

    public PublishException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public PublishException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static PublishException sendFailed(String topic, Throwable cause) {
        PublishException ex = new PublishException(
                ErrorCode.PUBLISH_SEND_FAILED,
                "Failed to publish to topic " + topic,
                cause);
        ex.withContext("topic", topic);
        return ex;
    }

    public static PublishException encodeFailed(String topic, Throwable cause) {
        PublishException ex = new PublishException(
                ErrorCode.PUBLISH_ENCODE_FAILED,
                "Failed to encode message for topic " + topic,
                cause);
        ex.withContext("topic", topic);
        return ex;
    }

    public static PublishException closed(String topic) {
        PublishException ex = new PublishException(
                ErrorCode.PUBLISH_PIPELINE_CLOSED,
                "Publishing pipeline closed for topic " + topic);
        ex.withContext("topic", topic);
        return ex;
    }
}
