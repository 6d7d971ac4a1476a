package com.phillippitts.captionhub.exception;

/**
 * Thrown when the persistence sink cannot write a batch.
 *
 * <p>{@link #isTransient()} tells the durable logger whether the same write may succeed later
 * (connection loss, lock timeout) and is worth retrying, or whether storage refused the data
 * itself (constraint violation) and retrying cannot help.
 */
public class PersistenceException extends CaptionHubException {

    private final int batchSize;
    private final boolean transientFailure;

    public PersistenceException(String message, int batchSize, Throwable cause, boolean transientFailure) {
        super(message + " (batchSize=" + batchSize + ", transient=" + transientFailure + ")", cause);
        this.batchSize = batchSize;
        this.transientFailure = transientFailure;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
