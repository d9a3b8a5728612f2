package org.longtrace.config.database;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.UUID;

/**
 * Per-store differences in DDL and parameter binding for the {@code spans} and {@code logs} tables.
 */
public enum SqlDialect {

    POSTGRES("UUID", "JSONB", "TIMESTAMP WITH TIME ZONE", "BIGSERIAL PRIMARY KEY", "?::jsonb") {
        @Override
        void bindUuid(PreparedStatement ps, int index, UUID value) throws SQLException {
            if (value == null) {
                ps.setNull(index, Types.OTHER);
            } else {
                ps.setObject(index, value);
            }
        }
    },

    SQLITE("TEXT", "TEXT", "TIMESTAMP", "INTEGER PRIMARY KEY AUTOINCREMENT", "?") {
        @Override
        void bindUuid(PreparedStatement ps, int index, UUID value) throws SQLException {
            if (value == null) {
                ps.setNull(index, Types.VARCHAR);
            } else {
                ps.setString(index, value.toString());
            }
        }
    };

    private final String uuidType;
    private final String jsonType;
    private final String timestampType;
    private final String identity;
    private final String jsonPlaceholder;

    SqlDialect(String uuidType, String jsonType, String timestampType, String identity, String jsonPlaceholder) {
        this.uuidType = uuidType;
        this.jsonType = jsonType;
        this.timestampType = timestampType;
        this.identity = identity;
        this.jsonPlaceholder = jsonPlaceholder;
    }

    abstract void bindUuid(PreparedStatement ps, int index, UUID value) throws SQLException;

    List<String> createSchemaStatements() {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS spans (
                    id %s,
                    trace_id %s NOT NULL,
                    span_id %s NOT NULL UNIQUE,
                    parent_span_id %s,
                    name TEXT NOT NULL,
                    attributes %s,
                    start_time %s NOT NULL,
                    end_time %s
                )
                """.formatted(identity, uuidType, uuidType, uuidType, jsonType, timestampType, timestampType),
                "CREATE INDEX IF NOT EXISTS idx_spans_trace_id ON spans(trace_id)",
                "CREATE INDEX IF NOT EXISTS idx_spans_parent_span_id ON spans(parent_span_id)",
                """
                CREATE TABLE IF NOT EXISTS logs (
                    id %s,
                    trace_id %s,
                    span_id %s,
                    message TEXT NOT NULL,
                    attributes %s,
                    timestamp %s NOT NULL
                )
                """.formatted(identity, uuidType, uuidType, jsonType, timestampType),
                "CREATE INDEX IF NOT EXISTS idx_logs_span_id ON logs(span_id)"
        );
    }

    String insertSpanSql() {
        return "INSERT INTO spans (trace_id, span_id, parent_span_id, name, attributes, start_time, end_time) "
                + "VALUES (?, ?, ?, ?, " + jsonPlaceholder + ", ?, ?)";
    }

    String insertLogSql() {
        return "INSERT INTO logs (trace_id, span_id, message, attributes, timestamp) "
                + "VALUES (?, ?, ?, " + jsonPlaceholder + ", ?)";
    }
}
