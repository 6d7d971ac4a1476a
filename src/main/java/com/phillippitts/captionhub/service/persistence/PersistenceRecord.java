package com.phillippitts.captionhub.service.persistence;

/**
 * One unit of work for the durable logger.
 */
public interface PersistenceRecord {

    /**
     * @return session the record belongs to; used for per-session drain and discard
     */
    String sessionId();
}
