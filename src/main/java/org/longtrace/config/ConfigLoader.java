package org.longtrace.config;

import org.longtrace.config.utils.XmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves the active {@link TraceConfiguration}:
 * the file named by {@code -Dlongtrace.config}, else {@code longtrace.xml} on the classpath,
 * else the built-in defaults.
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_PROPERTY = "longtrace.config";
    public static final String CLASSPATH_RESOURCE = "longtrace.xml";

    private ConfigLoader() {}

    public static TraceConfiguration loadDefault() {
        String explicitPath = System.getProperty(CONFIG_PROPERTY);
        if (explicitPath != null && !explicitPath.isBlank()) {
            return loadConfig(Path.of(explicitPath));
        }
        TraceConfiguration fromClasspath = loadResource(CLASSPATH_RESOURCE);
        if (fromClasspath != null) {
            return fromClasspath;
        }
        logger.debug("No {} found, using built-in defaults", CLASSPATH_RESOURCE);
        return new TraceConfiguration();
    }

    public static TraceConfiguration loadConfig(Path xmlPath) {
        try (InputStream in = Files.newInputStream(xmlPath)) {
            TraceConfiguration cfg = parse(in);
            logger.debug("Configuration loaded from {}", xmlPath);
            return cfg;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file " + xmlPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return the parsed resource, or {@code null} if it is not on the classpath
     */
    public static TraceConfiguration loadResource(String resourceName) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) loader = ConfigLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in == null) return null;
            TraceConfiguration cfg = parse(in);
            logger.debug("Configuration loaded from classpath:{}", resourceName);
            return cfg;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config resource " + resourceName + ": " + e.getMessage(), e);
        }
    }

    private static TraceConfiguration parse(InputStream in) throws Exception {
        Document doc = XmlUtil.parse(in);
        TraceConfiguration cfg = XmlUtil.unmarshal(doc, TraceConfiguration.class);
        if (cfg.tracing == null) cfg.tracing = new TraceConfiguration.Tracing();
        if (cfg.database == null) cfg.database = new TraceConfiguration.Database();
        if (cfg.connectionPool == null) cfg.connectionPool = new TraceConfiguration.ConnectionPool();
        return cfg;
    }
}
