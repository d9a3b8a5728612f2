package org.longtrace.config.database;

import org.junit.jupiter.api.Test;
import org.longtrace.config.ConnectionSettings;
import org.longtrace.config.TraceConfiguration;
import org.longtrace.exceptions.TraceConnectionException;
import org.longtrace.records.Attributes;
import org.longtrace.records.LogRecord;
import org.longtrace.records.SpanRecord;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Testcontainers(disabledWithoutDocker = true)
class PostgresDatabaseWriterTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    private static String connectionString() {
        return "postgresql://" + postgres.getUsername() + ":" + postgres.getPassword()
                + "@" + postgres.getHost() + ":" + postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT);
    }

    private static TraceConfiguration configuration() {
        TraceConfiguration cfg = new TraceConfiguration();
        cfg.connectionPool.maximumPoolSize = 2;
        cfg.connectionPool.minimumIdle = 0;
        return cfg;
    }

    private static int count(String database, String table) throws SQLException {
        ConnectionSettings settings = ConnectionSettings.parse(connectionString());
        try (Connection conn = java.sql.DriverManager.getConnection(settings.jdbcUrl(database), settings.driverProperties());
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    void createsDatabaseAndWritesRecords() throws Exception {
        try (PostgresDatabaseWriter writer = new PostgresDatabaseWriter(connectionString(), configuration())) {
            assertEquals("traces_it", writer.ensureDatabase("traces_it"));

            UUID trace = UUID.randomUUID();
            UUID span = UUID.randomUUID();
            Instant now = Instant.now();
            writer.writeBatch(List.of(
                    new LogRecord(trace, span, "inside", Attributes.parse("{\"n\": 1}"), now),
                    new SpanRecord(trace, span, null, "root", null, now, now.plusMillis(3))));
        }

        assertEquals(1, count("traces_it", "spans"));
        assertEquals(1, count("traces_it", "logs"));
    }

    @Test
    void reusesExistingDatabaseForEquivalentName() {
        try (PostgresDatabaseWriter first = new PostgresDatabaseWriter(connectionString(), configuration())) {
            assertEquals("reused_db", first.ensureDatabase("reused_db"));
        }
        try (PostgresDatabaseWriter second = new PostgresDatabaseWriter(connectionString(), configuration())) {
            assertEquals("reused_db", second.ensureDatabase("Reused-DB"));
        }
    }

    @Test
    void existingDatabaseIsUsedVerbatim() {
        // the maintenance database exists under its exact name
        try (PostgresDatabaseWriter writer = new PostgresDatabaseWriter(connectionString(), configuration())) {
            assertEquals("postgres", writer.ensureDatabase("postgres"));
        }
    }

    @Test
    void badCredentialsAreConnectionErrors() {
        String wrong = "postgresql://" + postgres.getUsername() + ":wrong-password@" + postgres.getHost()
                + ":" + postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT);
        try (PostgresDatabaseWriter writer = new PostgresDatabaseWriter(wrong, configuration())) {
            assertThrows(TraceConnectionException.class, () -> writer.ensureDatabase("never_created"));
        }
    }
}
