package com.salachat.repositorios.jdbc;

import com.salachat.entidades.Mensaje;
import com.salachat.entidades.MensajeFactory;
import com.salachat.entidades.TipoMensaje;
import com.salachat.repositorios.MensajeRepository;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expected schema fragment:
 * <pre>
 * CREATE TABLE mensajes (
 *   id BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   user_id BIGINT NOT NULL,
 *   kind VARCHAR(16) NOT NULL,
 *   sticker VARCHAR(64),
 *   reply_to BIGINT,
 *   content TEXT NOT NULL,
 *   created_at TIMESTAMP(3) NOT NULL
 * );
 * </pre>
 */
public class JdbcMensajeRepository extends JdbcSupport implements MensajeRepository {

    public JdbcMensajeRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public Mensaje save(Mensaje mensaje) {
        String sql = "INSERT INTO mensajes(user_id, kind, sticker, reply_to, content, created_at) VALUES(?,?,?,?,?,?)";
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, mensaje.getUserId());
            ps.setString(2, mensaje.getTipo().getWireName());
            if (mensaje.getSticker() != null) {
                ps.setString(3, mensaje.getSticker());
            } else {
                ps.setNull(3, Types.VARCHAR);
            }
            setNullableLong(ps, 4, mensaje.getReplyTo());
            ps.setString(5, mensaje.getContenido());
            ps.setTimestamp(6, Timestamp.from(mensaje.getCreatedAt()));
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (!rs.next()) {
                    throw new IllegalStateException("No generated key returned for message");
                }
                long id = rs.getLong(1);
                return MensajeFactory.crearMensaje(mensaje.getTipo(), id, mensaje.getUserId(), mensaje.getUsername(),
                        mensaje.getContenido(), mensaje.getSticker(), mensaje.getReplyTo(), mensaje.getCreatedAt());
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Error inserting message", e);
        }
    }

    @Override
    public List<Mensaje> findLatest(int limit) {
        String sql = "SELECT m.id, m.user_id, u.username, m.kind, m.sticker, m.reply_to, m.content, m.created_at " +
                "FROM mensajes m JOIN usuarios u ON u.id = m.user_id " +
                "ORDER BY m.id DESC LIMIT ?";
        List<Mensaje> result = new ArrayList<>();
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Error querying messages", e);
        }
        Collections.reverse(result);
        return result;
    }

    private Mensaje map(ResultSet rs) throws SQLException {
        // filas antiguas sin kind se tratan como texto
        TipoMensaje tipo = TipoMensaje.fromWireName(rs.getString("kind")).orElse(TipoMensaje.TEXT);
        String content = rs.getString("content");
        return MensajeFactory.crearMensaje(tipo,
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getString("username"),
                content != null ? content : "",
                rs.getString("sticker"),
                getNullableLong(rs, "reply_to"),
                getInstant(rs, "created_at"));
    }
}
