package com.ackmediator.common.exception;

/**
 * Failure to turn a message into bytes or back
 */
public class CodecException extends MessagingException {

    public CodecException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public CodecException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static CodecException encodeFailed(Class<?> type, Throwable cause) {
        CodecException ex = new CodecException(
                ErrorCode.CODEC_ENCODE_FAILED,
                "Failed to encode message of type " + type.getName(),
                cause);
        ex.withContext("type", type.getName());
        return ex;
    }
}
