package org.longtrace.config.database;

import org.longtrace.config.TraceConfiguration;

@FunctionalInterface
public interface DatabaseWriterFactory {

    DatabaseWriter create(String connectionString, TraceConfiguration configuration);

    static DatabaseWriterFactory postgres() {
        return PostgresDatabaseWriter::new;
    }
}
