package org.longtrace.config.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jetbrains.annotations.NotNull;
import org.longtrace.config.ConnectionSettings;
import org.longtrace.config.TraceConfiguration;
import org.longtrace.exceptions.TraceConnectionException;
import org.longtrace.records.TraceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;

/**
 * PostgreSQL backend: provisions the target database through the maintenance database,
 * then writes through a HikariCP pool.
 */
public class PostgresDatabaseWriter implements DatabaseWriter {
    private static final Logger logger = LoggerFactory.getLogger(PostgresDatabaseWriter.class);

    private static final String DUPLICATE_DATABASE = "42P04";

    private final ConnectionSettings settings;
    private final TraceConfiguration cfg;

    private volatile HikariDataSource dataSource;
    private volatile JdbcBatchWriter batchWriter;

    public PostgresDatabaseWriter(String connectionString, TraceConfiguration cfg) {
        this(ConnectionSettings.parse(connectionString), cfg);
    }

    public PostgresDatabaseWriter(ConnectionSettings settings, TraceConfiguration cfg) {
        this.settings = settings;
        this.cfg = cfg;
    }

    @Override
    public synchronized String ensureDatabase(String candidateName) {
        if (batchWriter != null) {
            throw new IllegalStateException("ensureDatabase has already been called");
        }
        logger.info("Resolving trace database for candidate '{}' on {}:{}", candidateName, settings.host(), settings.port());
        String resolved = lookupOrCreate(candidateName);

        HikariDataSource newDs;
        try {
            newDs = new HikariDataSource(getHikariConfig(resolved));
        } catch (RuntimeException e) {
            throw new TraceConnectionException("Failed to create connection pool for database " + resolved + ": " + e.getMessage(), e);
        }

        try {
            try (Connection conn = newDs.getConnection()) {
                if (!conn.isValid(cfg.database.connectTimeoutSeconds)) {
                    throw new TraceConnectionException("Connection failed: connection to " + resolved + " is invalid.");
                }
            }
            JdbcBatchWriter writer = new JdbcBatchWriter(newDs::getConnection, SqlDialect.POSTGRES,
                    cfg.database.writeTimeoutSeconds);
            writer.createSchema();

            dataSource = newDs;
            batchWriter = writer;
        } catch (SQLException e) {
            newDs.close();
            throw new TraceConnectionException("Failed to connect to database " + resolved + ": " + e.getMessage(), e);
        } catch (TraceConnectionException e) {
            newDs.close();
            throw e;
        } catch (RuntimeException e) {
            newDs.close();
            throw new TraceConnectionException("Failed to prepare trace tables in " + resolved + ": " + e.getMessage(), e);
        }

        logger.info("Trace database '{}' ready", resolved);
        return resolved;
    }

    /**
     * Exact match on the candidate first, then the sanitized derivation, creating the latter if absent.
     */
    private String lookupOrCreate(String candidateName) {
        String maintenanceUrl = settings.jdbcUrl(cfg.database.maintenanceDatabase);
        try (Connection admin = DriverManager.getConnection(maintenanceUrl, adminProperties())) {
            if (candidateName != null && databaseExists(admin, candidateName)) {
                logger.debug("Using existing database '{}'", candidateName);
                return candidateName;
            }
            String derived = DatabaseNames.derive(candidateName);
            if (!derived.equals(candidateName) && databaseExists(admin, derived)) {
                logger.debug("Using existing database '{}' derived from '{}'", derived, candidateName);
                return derived;
            }
            if (!DatabaseNames.isSafe(derived)) {
                throw new TraceConnectionException("Database name contains invalid characters: " + derived);
            }
            createDatabase(admin, derived);
            return derived;
        } catch (SQLException e) {
            throw new TraceConnectionException("Failed to resolve database on " + settings.host() + ":" + settings.port()
                    + ": " + e.getMessage(), e);
        }
    }

    private static boolean databaseExists(Connection admin, String name) throws SQLException {
        try (PreparedStatement ps = admin.prepareStatement(
                "SELECT EXISTS(SELECT 1 FROM pg_database WHERE datname = ?)")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static void createDatabase(Connection admin, String name) throws SQLException {
        // identifiers cannot be bound as parameters; name has passed DatabaseNames.isSafe
        try (Statement st = admin.createStatement()) {
            st.execute("CREATE DATABASE " + DatabaseNames.quote(name));
            logger.info("Created database '{}'", name);
        } catch (SQLException e) {
            if (DUPLICATE_DATABASE.equals(e.getSQLState())) {
                logger.debug("Database '{}' was created concurrently", name);
                return;
            }
            throw e;
        }
    }

    Properties adminProperties() {
        Properties props = settings.driverProperties();
        props.setProperty("connectTimeout", String.valueOf(cfg.database.connectTimeoutSeconds));
        props.setProperty("loginTimeout", String.valueOf(cfg.database.connectTimeoutSeconds));
        props.setProperty("socketTimeout", String.valueOf(socketTimeoutSeconds()));
        applySsl(props);
        return props;
    }

    private void applySsl(Properties props) {
        if (cfg.database.ssl) {
            props.setProperty("ssl", "true");
            props.setProperty("sslmode", props.getProperty("sslmode", "require"));
        }
    }

    /**
     * Upper bound on a blocked socket read. Longer than the query timeout so a cancelled
     * statement still reports as a cancel while the server is reachable.
     */
    int socketTimeoutSeconds() {
        return cfg.database.writeTimeoutSeconds + cfg.database.connectTimeoutSeconds;
    }

    @NotNull
    HikariConfig getHikariConfig(String database) {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("longtrace-" + database);
        hc.setJdbcUrl(settings.jdbcUrl(database));
        hc.setUsername(settings.user());
        hc.setPassword(settings.password());
        hc.setDriverClassName("org.postgresql.Driver");
        hc.setMaximumPoolSize(cfg.connectionPool.maximumPoolSize);
        hc.setMinimumIdle(cfg.connectionPool.minimumIdle);
        hc.setIdleTimeout(cfg.connectionPool.idleTimeout);
        hc.setConnectionTimeout(cfg.connectionPool.connectionTimeout);
        hc.setMaxLifetime(cfg.connectionPool.maxLifetime);

        Properties props = new Properties();
        props.putAll(settings.parameters());
        props.setProperty("connectTimeout", String.valueOf(cfg.database.connectTimeoutSeconds));
        props.setProperty("socketTimeout", String.valueOf(socketTimeoutSeconds()));
        applySsl(props);
        hc.setDataSourceProperties(props);
        return hc;
    }

    @Override
    public void writeBatch(List<TraceRecord> records) {
        JdbcBatchWriter writer = batchWriter;
        if (writer == null) {
            throw new IllegalStateException("writeBatch called before ensureDatabase");
        }
        writer.write(records);
    }

    @Override
    public synchronized void close() {
        if (dataSource != null) {
            try {
                dataSource.close();
                logger.info("Trace connection pool shutdown successfully.");
            } catch (Exception e) {
                logger.warn("Error shutting down trace connection pool: {}", e.getMessage());
            }
        }
    }
}
