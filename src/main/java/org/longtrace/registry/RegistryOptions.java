package org.longtrace.registry;

import org.longtrace.config.TraceConfiguration;
import org.longtrace.config.database.DatabaseWriterFactory;
import org.longtrace.utils.IdSource;
import org.longtrace.utils.MonotonicIdSource;

/**
 * Everything {@link TraceRegistry#initialize} needs. {@code candidateName} may be null,
 * meaning "today's date".
 */
public record RegistryOptions(String connectionString, int batchSize, String candidateName,
                              TraceConfiguration configuration, DatabaseWriterFactory writerFactory,
                              IdSource idSource) {

    public static RegistryOptions of(String connectionString, int batchSize, String candidateName,
                                     TraceConfiguration configuration) {
        return new RegistryOptions(connectionString, batchSize, candidateName, configuration,
                DatabaseWriterFactory.postgres(), new MonotonicIdSource());
    }

    public RegistryOptions withWriterFactory(DatabaseWriterFactory factory) {
        return new RegistryOptions(connectionString, batchSize, candidateName, configuration, factory, idSource);
    }

    public RegistryOptions withIdSource(IdSource source) {
        return new RegistryOptions(connectionString, batchSize, candidateName, configuration, writerFactory, source);
    }
}
