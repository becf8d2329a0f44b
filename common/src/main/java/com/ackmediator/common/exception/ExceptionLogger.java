package com.ackmediator.common.exception;

import org.slf4j.Logger;

/**
 * Logs {@link MessagingException}s with their structured message
 */
public final class ExceptionLogger {

    private ExceptionLogger() {
    }

    public static void logError(Logger log, MessagingException ex) {
        log.error(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    public static void logWarn(Logger log, MessagingException ex) {
        log.warn(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    /**
     * Retriable: WARN, non-retriable: ERROR
     */
    public static void logConditional(Logger log, MessagingException ex) {
        if (ex.isRetriable()) {
            logWarn(log, ex);
        } else {
            logError(log, ex);
        }
    }

    /**
     * Unwraps completion wrappers; anything that is not a {@link MessagingException} is logged at ERROR
     */
    public static void logFailure(Logger log, String message, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof MessagingException) {
            logConditional(log, (MessagingException) cause);
        } else {
            log.error(message, cause);
        }
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof java.util.concurrent.CompletionException
                || current instanceof java.util.concurrent.ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
