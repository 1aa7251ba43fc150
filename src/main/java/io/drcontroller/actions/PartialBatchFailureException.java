package io.drcontroller.actions;

import io.drcontroller.models.BatchResult;
import lombok.Getter;

/**
 * Exception thrown by {@link BatchResult#requireFullSuccess()} when at least one
 * relationship did not succeed.
 */
@Getter
public class PartialBatchFailureException extends RuntimeException {

    private final transient BatchResult batch;

    public PartialBatchFailureException(BatchResult batch) {
        super(batch.getAction() + " on " + batch.getApplication() + " did not fully succeed: " + batch.summary());
        this.batch = batch;
    }
}
