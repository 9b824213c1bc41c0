package com.salachat.repositorios.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.logging.Logger;

/**
 * Utility class that makes sure the minimum schema required by the
 * repositories exists before the application starts interacting with the
 * database. The statements are idempotent so they can be executed on every
 * boot without affecting existing data.
 */
public final class DatabaseInitializer {

    private static final Logger LOGGER = Logger.getLogger(DatabaseInitializer.class.getName());

    private DatabaseInitializer() {
    }

    public static void ensureSchema(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : schemaStatements()) {
                statement.executeUpdate(ddl);
            }
            LOGGER.info("Esquema de base de datos verificado");
        } catch (SQLException e) {
            throw new IllegalStateException("Unable to initialise database schema", e);
        }
    }

    private static List<String> schemaStatements() {
        return List.of(
                "CREATE TABLE IF NOT EXISTS usuarios (" +
                        "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
                        "username VARCHAR(64) NOT NULL UNIQUE," +
                        "password_hash VARCHAR(255) NOT NULL," +
                        "is_admin BOOLEAN NOT NULL DEFAULT FALSE," +
                        "is_active BOOLEAN NOT NULL DEFAULT TRUE," +
                        "created_at TIMESTAMP(3) NOT NULL" +
                        ")",
                "CREATE TABLE IF NOT EXISTS mensajes (" +
                        "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
                        "user_id BIGINT NOT NULL," +
                        "kind VARCHAR(16) NOT NULL DEFAULT 'text'," +
                        "sticker VARCHAR(64) NULL," +
                        "reply_to BIGINT NULL," +
                        "content TEXT NOT NULL," +
                        "created_at TIMESTAMP(3) NOT NULL," +
                        "FOREIGN KEY (user_id) REFERENCES usuarios(id)" +
                        ")"
        );
    }
}
