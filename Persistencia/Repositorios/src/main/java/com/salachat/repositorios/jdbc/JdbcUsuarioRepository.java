package com.salachat.repositorios.jdbc;

import com.salachat.entidades.Usuario;
import com.salachat.repositorios.DuplicateUsernameException;
import com.salachat.repositorios.UsuarioRepository;

import javax.sql.DataSource;
import java.sql.*;
import java.util.Optional;

/**
 * JDBC implementation. Expected schema:
 * <pre>
 * CREATE TABLE usuarios (
 *   id BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   username VARCHAR(64) UNIQUE NOT NULL,
 *   password_hash VARCHAR(255) NOT NULL,
 *   is_admin BOOLEAN NOT NULL,
 *   is_active BOOLEAN NOT NULL,
 *   created_at TIMESTAMP(3) NOT NULL
 * );
 * </pre>
 */
public class JdbcUsuarioRepository extends JdbcSupport implements UsuarioRepository {

    private static final String COLUMNS = "id, username, password_hash, is_admin, is_active, created_at";

    public JdbcUsuarioRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public Usuario save(Usuario usuario) {
        String sql = "INSERT INTO usuarios(username, password_hash, is_admin, is_active, created_at) VALUES(?,?,?,?,?)";
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, usuario.getUsername());
            ps.setString(2, usuario.getPasswordHash());
            ps.setBoolean(3, usuario.isAdmin());
            ps.setBoolean(4, usuario.isActive());
            ps.setTimestamp(5, Timestamp.from(usuario.getCreatedAt()));
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    usuario.setId(rs.getLong(1));
                }
            }
            return usuario;
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new DuplicateUsernameException(usuario.getUsername(), e);
            }
            throw new IllegalStateException("Error inserting user", e);
        }
    }

    @Override
    public Optional<Usuario> findById(Long id) {
        return findOne("SELECT " + COLUMNS + " FROM usuarios WHERE id=?", id);
    }

    @Override
    public Optional<Usuario> findByUsername(String username) {
        return findOne("SELECT " + COLUMNS + " FROM usuarios WHERE username=?", username);
    }

    private Optional<Usuario> findOne(String sql, Object param) {
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Error finding user", e);
        }
        return Optional.empty();
    }

    private Usuario map(ResultSet rs) throws SQLException {
        Usuario usuario = new Usuario();
        usuario.setId(rs.getLong("id"));
        usuario.setUsername(rs.getString("username"));
        usuario.setPasswordHash(rs.getString("password_hash"));
        usuario.setAdmin(rs.getBoolean("is_admin"));
        usuario.setActive(rs.getBoolean("is_active"));
        usuario.setCreatedAt(getInstant(rs, "created_at"));
        return usuario;
    }
}
