package org.longtrace.config.database;

import org.longtrace.records.Attributes;
import org.longtrace.records.LogRecord;
import org.longtrace.records.SpanRecord;
import org.longtrace.records.TraceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/**
 * Writes trace records through plain JDBC, one transaction per batch.
 */
public class JdbcBatchWriter {
    private static final Logger logger = LoggerFactory.getLogger(JdbcBatchWriter.class);

    @FunctionalInterface
    public interface ConnectionSource {
        Connection get() throws SQLException;
    }

    private final ConnectionSource connectionSource;
    private final SqlDialect dialect;
    private final int queryTimeoutSeconds;

    public JdbcBatchWriter(ConnectionSource connectionSource, SqlDialect dialect, int queryTimeoutSeconds) {
        this.connectionSource = connectionSource;
        this.dialect = dialect;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Creates the {@code spans} and {@code logs} tables and their indexes if missing.
     */
    public void createSchema() {
        try (Connection conn = connectionSource.get();
             Statement st = conn.createStatement()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(true);
            try {
                st.setQueryTimeout(queryTimeoutSeconds);
                for (String ddl : dialect.createSchemaStatements()) {
                    st.execute(ddl);
                }
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            logger.debug("Trace schema ready ({})", dialect);
        } catch (SQLException e) {
            throw SqlErrors.classify("Failed to create trace tables", e);
        }
    }

    public void write(List<TraceRecord> records) {
        if (records.isEmpty()) return;

        try (Connection conn = connectionSource.get()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement spans = conn.prepareStatement(dialect.insertSpanSql());
                 PreparedStatement logs = conn.prepareStatement(dialect.insertLogSql())) {
                spans.setQueryTimeout(queryTimeoutSeconds);
                logs.setQueryTimeout(queryTimeoutSeconds);

                int spanCount = 0;
                int logCount = 0;
                for (TraceRecord record : records) {
                    if (record instanceof SpanRecord span) {
                        bindSpan(spans, span);
                        spans.addBatch();
                        spanCount++;
                    } else if (record instanceof LogRecord log) {
                        bindLog(logs, log);
                        logs.addBatch();
                        logCount++;
                    }
                }
                if (spanCount > 0) spans.executeBatch();
                if (logCount > 0) logs.executeBatch();
                conn.commit();
                logger.debug("Committed batch: {} spans, {} logs", spanCount, logCount);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw SqlErrors.classify("Failed to write batch of " + records.size() + " records", e);
        }
    }

    private void bindSpan(PreparedStatement ps, SpanRecord span) throws SQLException {
        dialect.bindUuid(ps, 1, span.traceId());
        dialect.bindUuid(ps, 2, span.spanId());
        dialect.bindUuid(ps, 3, span.parentSpanId());
        ps.setString(4, span.name());
        bindJson(ps, 5, span.attributes());
        bindTimestamp(ps, 6, span.startTime());
        bindTimestamp(ps, 7, span.endTime());
    }

    private void bindLog(PreparedStatement ps, LogRecord log) throws SQLException {
        dialect.bindUuid(ps, 1, log.traceId());
        dialect.bindUuid(ps, 2, log.spanId());
        ps.setString(3, log.message());
        bindJson(ps, 4, log.attributes());
        bindTimestamp(ps, 5, log.timestamp());
    }

    private static void bindJson(PreparedStatement ps, int index, Attributes attributes) throws SQLException {
        if (attributes == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, attributes.json());
        }
    }

    private static void bindTimestamp(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(index, Timestamp.from(value));
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            logger.warn("Rollback failed: {}", rollbackFailure.getMessage());
        }
    }
}
