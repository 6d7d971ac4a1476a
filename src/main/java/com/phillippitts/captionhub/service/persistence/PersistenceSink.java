package com.phillippitts.captionhub.service.persistence;

import com.phillippitts.captionhub.exception.PersistenceException;

import java.util.List;

/**
 * Storage backend of the durable logger.
 *
 * <p>Writes must be idempotent per record key: a batch that is retried after a partial
 * failure may contain records that were already stored.
 */
public interface PersistenceSink {

    /**
     * Stores every record of the batch.
     *
     * @throws PersistenceException when the batch could not be stored
     */
    void write(List<PersistenceRecord> batch);

    String name();
}
