package org.longtrace.config;

import jakarta.xml.bind.annotation.XmlRootElement;

/**
 * Tunables for the tracing client, bound from {@code longtrace.xml}.
 * Every field has a default, so any element may be left out.
 */
@XmlRootElement(name = "longtrace")
public class TraceConfiguration {

    public Tracing tracing = new Tracing();
    public Database database = new Database();
    public ConnectionPool connectionPool = new ConnectionPool();

    // --- Batching / flushing ---
    @XmlRootElement(name = "tracing")
    public static class Tracing {
        public int batchSize = 10;
        /** 0 disables the background flush. */
        public long flushIntervalSeconds = 0;
        public boolean flushOnShutdown = true;
    }

    // --- Database provisioning and writes ---
    @XmlRootElement(name = "database")
    public static class Database {
        public String maintenanceDatabase = "postgres";
        public boolean ssl = false;
        public int connectTimeoutSeconds = 10;
        public int writeTimeoutSeconds = 30;
    }

    // --- HikariCP Connection Pool ---
    @XmlRootElement(name = "connectionPool")
    public static class ConnectionPool {
        public int maximumPoolSize = 4;
        public int minimumIdle = 1;
        public long idleTimeout = 600_000;
        public long connectionTimeout = 10_000;
        public long maxLifetime = 1_800_000;
    }
}
