package com.ackmediator.common.exception;

/**
 * A record whose value cannot be decoded.
 * Consumption pipelines treat this as recoverable: the record is skipped and the stream resumes.
 */
public class DecodeException extends CodecException {

    public DecodeException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public DecodeException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static DecodeException malformed(String manifest, Throwable cause) {
        DecodeException ex = new DecodeException(
                ErrorCode.CODEC_DECODE_FAILED,
                "Unable to deserialize message with manifest " + manifest,
                cause);
        ex.withContext("manifest", manifest);
        return ex;
    }

    public static DecodeException unknownManifest(String manifest) {
        DecodeException ex = new DecodeException(
                ErrorCode.CODEC_UNKNOWN_MANIFEST,
                "No type registered for manifest " + manifest);
        ex.withContext("manifest", manifest);
        return ex;
    }
}
