package com.phillippitts.captionhub.service.persistence;

import com.phillippitts.captionhub.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;

/**
 * JDBC sink writing to two tables:
 *
 * <pre>
 * caption_translations (session_id, sequence_no, language, outcome, source_text, text, failure_reason, completed_at)
 *     PRIMARY KEY (session_id, sequence_no, language)
 * session_events (session_id, state, occurred_at)
 *     PRIMARY KEY (session_id, state)
 * </pre>
 *
 * <p>Each record is an update-then-insert upsert so a repeated write of the same key leaves
 * exactly one row. A batch runs in a single transaction.
 *
 * <p>Failures are classified for the durable logger: lost connections, lock timeouts and
 * other {@link TransientDataAccessException}s are transient; constraint violations and the
 * rest of Spring's non-transient hierarchy are not.
 */
@Component
public class JdbcPersistenceSink implements PersistenceSink {

    private static final Logger LOG = LogManager.getLogger(JdbcPersistenceSink.class);

    static final String UPDATE_TRANSLATION = "UPDATE caption_translations SET outcome = ?, source_text = ?, "
            + "text = ?, failure_reason = ?, completed_at = ? "
            + "WHERE session_id = ? AND sequence_no = ? AND language = ?";
    static final String INSERT_TRANSLATION = "INSERT INTO caption_translations "
            + "(session_id, sequence_no, language, outcome, source_text, text, failure_reason, completed_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    static final String UPDATE_EVENT = "UPDATE session_events SET occurred_at = ? WHERE session_id = ? AND state = ?";
    static final String INSERT_EVENT = "INSERT INTO session_events (session_id, state, occurred_at) VALUES (?, ?, ?)";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcPersistenceSink(JdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.tx = Objects.requireNonNull(tx, "tx");
    }

    @Override
    public void write(List<PersistenceRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            tx.executeWithoutResult(status -> batch.forEach(this::upsert));
            LOG.debug("Stored batch of {} record(s)", batch.size());
        } catch (DataAccessException e) {
            throw new PersistenceException("JDBC batch write failed: " + e.getMostSpecificCause().getMessage(),
                    batch.size(), e, isTransient(e));
        }
    }

    static boolean isTransient(DataAccessException e) {
        return e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException;
    }

    @Override
    public String name() {
        return "jdbc";
    }

    private void upsert(PersistenceRecord record) {
        if (record instanceof TranslationRecord t) {
            Timestamp at = Timestamp.from(t.completedAt());
            int updated = jdbc.update(UPDATE_TRANSLATION, t.outcome(), t.sourceText(), t.text(), t.failureReason(),
                    at, t.sessionId(), t.sequence(), t.language());
            if (updated == 0) {
                jdbc.update(INSERT_TRANSLATION, t.sessionId(), t.sequence(), t.language(), t.outcome(),
                        t.sourceText(), t.text(), t.failureReason(), at);
            }
        } else if (record instanceof SessionEventRecord e) {
            Timestamp at = Timestamp.from(e.occurredAt());
            int updated = jdbc.update(UPDATE_EVENT, at, e.sessionId(), e.state().name());
            if (updated == 0) {
                jdbc.update(INSERT_EVENT, e.sessionId(), e.state().name(), at);
            }
        } else {
            throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
        }
    }
}
