package org.longtrace.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads settings from the process environment, falling back to a {@code .env} file
 * in the working directory.
 */
public class EnvironmentProvider {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentProvider.class);

    public static final String DATABASE_URL = "DATABASE_URL";
    public static final String LONGTRACE_DB_URL = "LONGTRACE_DB_URL";
    public static final String LONGTRACE_DB_NAME = "LONGTRACE_DB_NAME";
    public static final String LONGTRACE_BATCH_SIZE = "LONGTRACE_BATCH_SIZE";

    private static EnvironmentProvider system;

    private final Dotenv dotenv;

    public EnvironmentProvider(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    /** Environment backed by {@code ./.env}, loaded once. */
    public static synchronized EnvironmentProvider system() {
        if (system == null) {
            system = new EnvironmentProvider(Dotenv.configure().ignoreIfMissing().load());
        }
        return system;
    }

    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = dotenv.get(key);
        }
        return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value.trim());
    }

    /** {@code DATABASE_URL} wins over {@code LONGTRACE_DB_URL}. */
    public Optional<String> connectionString() {
        Optional<String> url = get(DATABASE_URL);
        return url.isPresent() ? url : get(LONGTRACE_DB_URL);
    }

    public Optional<String> databaseName() {
        return get(LONGTRACE_DB_NAME);
    }

    public Optional<Integer> batchSize() {
        return get(LONGTRACE_BATCH_SIZE).flatMap(raw -> {
            try {
                return Optional.of(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not an integer", LONGTRACE_BATCH_SIZE, raw);
                return Optional.empty();
            }
        });
    }
}
