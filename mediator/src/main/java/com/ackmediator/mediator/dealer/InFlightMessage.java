package com.ackmediator.mediator.dealer;

import com.ackmediator.common.model.LogRecord;

/**
 * A decoded record handed to one dealer
 */
public class InFlightMessage {
    private final LogRecord record;
    private final Object payload;

    public InFlightMessage(LogRecord record, Object payload) {
        this.record = record;
        this.payload = payload;
    }

    public LogRecord getRecord() {
        return record;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "InFlightMessage{topic=" + record.getTopic() + ", partition=" + record.getPartition()
                + ", offset=" + record.getOffset() + "}";
    }
}
