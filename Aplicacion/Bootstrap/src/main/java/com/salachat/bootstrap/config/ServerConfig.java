package com.salachat.bootstrap.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Centralised configuration helper that reads the <code>properties/server.properties</code> file
 * from the classpath and exposes typed accessors for the listener, protocol limits, metrics,
 * first-run admin provisioning and logging. A JVM system property with the same key overrides
 * the value from the file.
 */
public final class ServerConfig {

    private static final Logger LOGGER = Logger.getLogger(ServerConfig.class.getName());
    private static final String CONFIG_PATH = "/properties/server.properties";

    public static final int DEFAULT_PORT = 8765;
    public static final int DEFAULT_MAX_FRAME_BYTES = 2_000_000;

    private static volatile ServerConfig instance;

    private final Properties properties = new Properties();

    private ServerConfig(String resourcePath) {
        loadProperties(resourcePath);
    }

    public static ServerConfig getInstance() {
        ServerConfig current = instance;
        if (current == null) {
            synchronized (ServerConfig.class) {
                current = instance;
                if (current == null) {
                    current = new ServerConfig(CONFIG_PATH);
                    instance = current;
                }
            }
        }
        return current;
    }

    /**
     * Carga una configuración desde otro recurso del classpath.
     */
    public static ServerConfig load(String resourcePath) {
        return new ServerConfig(resourcePath);
    }

    private void loadProperties(String resourcePath) {
        try (InputStream in = ServerConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file not found at " + resourcePath);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load server configuration properties", e);
        }
    }

    public String getProperty(String key) {
        String override = System.getProperty(key);
        if (override != null) {
            return override;
        }
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    public int getIntProperty(String key, int defaultValue) {
        String raw = getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOGGER.log(Level.WARNING, "Invalid integer for {0}: {1}", new Object[]{key, raw});
            return defaultValue;
        }
    }

    public String getHost() {
        return getProperty("server.host", "0.0.0.0");
    }

    public int getServerPort() {
        return getIntProperty("server.port", DEFAULT_PORT);
    }

    public int getMaxConnections() {
        return getIntProperty("server.maxConnections", 100);
    }

    public int getMaxFrameBytes() {
        return getIntProperty("server.maxFrameBytes", DEFAULT_MAX_FRAME_BYTES);
    }

    public int getOutboundQueueCapacity() {
        return getIntProperty("server.outboundQueueCapacity", 256);
    }

    public int getHistoryLimit() {
        return getIntProperty("history.limit", 80);
    }

    /**
     * Puerto del endpoint Prometheus; 0 o negativo lo deshabilita.
     */
    public int getMetricsPort() {
        return getIntProperty("metrics.port", getServerPort() + 100);
    }

    public String getAdminUsername() {
        String value = getProperty("admin.username", "");
        return value.trim();
    }

    /**
     * Contraseña para el administrador inicial, o {@code null} si debe pedirse por consola.
     */
    public String getAdminPassword() {
        String value = getProperty("admin.password");
        return value == null || value.isEmpty() ? null : value;
    }

    public Level getLogLevel() {
        String level = getProperty("log.level");
        if (level == null || level.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Invalid log level {0}, defaulting to INFO", level);
            return Level.INFO;
        }
    }
}
