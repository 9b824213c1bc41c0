package com.salachat.configdb;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.sql.DataSource;

import com.mysql.cj.jdbc.MysqlConnectionPoolDataSource;

/**
 * Centralised configuration helper that reads the <code>properties/database.properties</code> file
 * from the classpath and exposes typed accessors used by the data access layers.
 * A JVM system property with the same key overrides the value from the file.
 */
public final class DBConfig {

    private static final Logger LOGGER = Logger.getLogger(DBConfig.class.getName());
    private static final String DATABASE_CONFIG_PATH = "/properties/database.properties";
    private static final DBConfig INSTANCE = new DBConfig(DATABASE_CONFIG_PATH);

    private final Properties properties = new Properties();
    private volatile DataSource dataSource;

    DBConfig(String resourcePath) {
        loadProperties(resourcePath);
    }

    public static DBConfig getInstance() {
        return INSTANCE;
    }

    private void loadProperties(String resourcePath) {
        try (InputStream in = DBConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file not found at " + resourcePath);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load database configuration properties", e);
        }
    }

    private DataSource buildMySqlDataSource() {
        MysqlConnectionPoolDataSource ds = new MysqlConnectionPoolDataSource();
        ds.setURL(require("mysql.url"));
        ds.setUser(require("mysql.user"));
        ds.setPassword(getProperty("mysql.password", ""));
        Optional.ofNullable(getProperty("mysql.driver"))
                .ifPresent(driver -> {
                    try {
                        Class.forName(driver);
                    } catch (ClassNotFoundException e) {
                        LOGGER.log(Level.WARNING, "JDBC driver not found: {0}", driver);
                    }
                });
        LOGGER.log(Level.INFO, "DataSource MySQL configurado para {0}", getProperty("mysql.url"));
        return ds;
    }

    public String require(String key) {
        return Optional.ofNullable(getProperty(key))
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new IllegalStateException("Missing property: " + key));
    }

    /**
     * Devuelve el {@link DataSource} de MySQL, construido en el primer acceso.
     */
    public DataSource getMySqlDataSource() {
        DataSource current = dataSource;
        if (current == null) {
            synchronized (this) {
                current = dataSource;
                if (current == null) {
                    current = buildMySqlDataSource();
                    dataSource = current;
                }
            }
        }
        return current;
    }

    public static String requireProperty(String key) {
        return INSTANCE.require(key);
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
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOGGER.log(Level.WARNING, "Invalid integer for {0}: {1}", new Object[]{key, raw});
            return defaultValue;
        }
    }
}
