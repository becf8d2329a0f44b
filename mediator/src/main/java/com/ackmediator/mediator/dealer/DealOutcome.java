package com.ackmediator.mediator.dealer;

/**
 * Terminal result of one delivery
 */
public class DealOutcome {

    public enum Kind {
        SUCCESS,
        FAILURE,
        ATTEMPTS_EXHAUSTED
    }

    private static final DealOutcome SUCCESS = new DealOutcome(Kind.SUCCESS, null);
    private static final DealOutcome ATTEMPTS_EXHAUSTED = new DealOutcome(Kind.ATTEMPTS_EXHAUSTED, null);

    private final Kind kind;
    private final Exception reason;

    private DealOutcome(Kind kind, Exception reason) {
        this.kind = kind;
        this.reason = reason;
    }

    public static DealOutcome success() {
        return SUCCESS;
    }

    public static DealOutcome attemptsExhausted() {
        return ATTEMPTS_EXHAUSTED;
    }

    public static DealOutcome failure(Exception reason) {
        return new DealOutcome(Kind.FAILURE, reason);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return Why the delivery failed, null unless {@link Kind#FAILURE}
     */
    public Exception getReason() {
        return reason;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    @Override
    public String toString() {
        return reason == null ? kind.name() : kind + "(" + reason.getMessage() + ")";
    }
}
