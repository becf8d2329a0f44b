package com.ackmediator.common.api;

import com.ackmediator.common.model.LogRecord;

import java.util.concurrent.CompletableFuture;

/**
 * A record plus the handle that durably advances its partition's committed offset
 */
public interface CommittableRecord {

    LogRecord getRecord();

    /**
     * Commit this record's offset for its group. Usable once; a second call fails with
     * {@code CONSUMER_OFFSET_ALREADY_COMMITTED}.
     *
     * @return Future completing when the log confirmed the commit
     */
    CompletableFuture<Void> commit();
}
