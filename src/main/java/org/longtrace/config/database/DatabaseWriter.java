package org.longtrace.config.database;

import org.longtrace.exceptions.TraceConnectionException;
import org.longtrace.exceptions.TraceWriteException;
import org.longtrace.records.TraceRecord;

import java.util.List;

/**
 * Persistence backend behind the batch buffer. Implementations own their connections.
 */
public interface DatabaseWriter extends AutoCloseable {

    /**
     * Looks up the candidate database, creating one derived from it if needed, and prepares
     * the schema. Called once, before any {@link #writeBatch}.
     *
     * @return the name of the database that will receive writes
     * @throws TraceConnectionException if the store is unreachable or the database cannot be created
     */
    String ensureDatabase(String candidateName);

    /**
     * Persists all records in one transaction: either every row commits or none does.
     *
     * @throws TraceConnectionException on transport, authentication or timeout failures
     * @throws TraceWriteException if the store rejects the batch
     */
    void writeBatch(List<TraceRecord> records);

    @Override
    void close();
}
