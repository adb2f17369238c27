package io.hyperfoil.tools.select.lsp;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server settings read from {@value #RESOURCE} on the classpath.
 * A system property {@code lisp-select.<key>} takes precedence over the same key in the file.
 */
public class ServerSettings {

    private static final Logger LOG = Logger.getLogger(ServerSettings.class.getName());

    public static final String RESOURCE = "lisp-select.properties";
    public static final String SYSTEM_PREFIX = "lisp-select.";

    public static final String SERVER_NAME = "server.name";
    public static final String SERVER_VERSION = "server.version";
    public static final String MAX_DEPTH = "selection-range.max-depth";
    public static final String INCLUDE_INSIDE = "selection-range.include-inside";

    private static final String DEFAULT_NAME = "Lisp Select Language Server";
    private static final String DEFAULT_VERSION = "0.1.0-SNAPSHOT";
    private static final int DEFAULT_MAX_DEPTH = 64;

    private final Properties properties;

    public ServerSettings(Properties properties) {
        this.properties = properties;
    }

    public static ServerSettings load() {
        return load(System.getProperties());
    }

    public static ServerSettings load(Properties systemProperties) {
        Properties props = new Properties();
        try (InputStream is = ServerSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            } else {
                LOG.warning(RESOURCE + " not found in classpath, using defaults");
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load " + RESOURCE, e);
        }
        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), systemProperties.getProperty(name));
            }
        }
        return new ServerSettings(props);
    }

    /**
     * A copy of these settings with {@code overrides} applied on top.
     */
    public ServerSettings with(Map<String, String> overrides) {
        Properties props = new Properties();
        props.putAll(properties);
        overrides.forEach(props::setProperty);
        return new ServerSettings(props);
    }

    public String getServerName() {
        return properties.getProperty(SERVER_NAME, DEFAULT_NAME);
    }

    public String getServerVersion() {
        return properties.getProperty(SERVER_VERSION, DEFAULT_VERSION);
    }

    public int getSelectionRangeMaxDepth() {
        String value = properties.getProperty(MAX_DEPTH);
        if (value == null) {
            return DEFAULT_MAX_DEPTH;
        }
        try {
            int depth = Integer.parseInt(value.trim());
            if (depth > 0) {
                return depth;
            }
        } catch (NumberFormatException e) {
            LOG.log(Level.FINE, "Not a number: " + value, e);
        }
        LOG.warning(MAX_DEPTH + " must be a positive number, was " + value);
        return DEFAULT_MAX_DEPTH;
    }

    public boolean isSelectionRangeIncludeInside() {
        return Boolean.parseBoolean(properties.getProperty(INCLUDE_INSIDE, "true").trim());
    }
}
