package com.ackmediator.mediator.consumer;

/**
 * Outcome of decoding one record
 */
public class DecodeResult {

    public enum Status {
        OK,
        /** The record is unreadable; the stream itself is fine */
        DECODE_ERROR,
        /** The pipeline cannot continue */
        FATAL
    }

    private final Status status;
    private final Object message;
    private final Exception error;

    private DecodeResult(Status status, Object message, Exception error) {
        this.status = status;
        this.message = message;
        this.error = error;
    }

    public static DecodeResult ok(Object message) {
        return new DecodeResult(Status.OK, message, null);
    }

    public static DecodeResult decodeError(Exception error) {
        return new DecodeResult(Status.DECODE_ERROR, null, error);
    }

    public static DecodeResult fatal(Exception error) {
        return new DecodeResult(Status.FATAL, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public Object getMessage() {
        return message;
    }

    public Exception getError() {
        return error;
    }
}
