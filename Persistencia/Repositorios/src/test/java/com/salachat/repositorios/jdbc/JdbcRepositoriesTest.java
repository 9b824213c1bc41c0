package com.salachat.repositorios.jdbc;

import com.salachat.entidades.Mensaje;
import com.salachat.entidades.MensajeFactory;
import com.salachat.entidades.TipoMensaje;
import com.salachat.entidades.Usuario;
import com.salachat.repositorios.DuplicateUsernameException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcRepositoriesTest {

    private JdbcUsuarioRepository usuarios;
    private JdbcMensajeRepository mensajes;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
        DatabaseInitializer.ensureSchema(dataSource);
        // idempotente
        DatabaseInitializer.ensureSchema(dataSource);
        usuarios = new JdbcUsuarioRepository(dataSource);
        mensajes = new JdbcMensajeRepository(dataSource);
    }

    @Test
    void guardaYBuscaUsuarioPorNombre() {
        Usuario saved = usuarios.save(nuevoUsuario("alice", true));

        assertNotNull(saved.getId());
        Optional<Usuario> found = usuarios.findByUsername("alice");
        assertTrue(found.isPresent());
        assertEquals(saved.getId(), found.get().getId());
        assertTrue(found.get().isAdmin());
        assertTrue(found.get().isActive());
        assertEquals("hash", found.get().getPasswordHash());
        assertTrue(usuarios.findById(saved.getId()).isPresent());
        assertFalse(usuarios.findByUsername("bob").isPresent());
    }

    @Test
    void nombreDuplicadoLanzaExcepcionEspecifica() {
        usuarios.save(nuevoUsuario("alice", false));

        assertThrows(DuplicateUsernameException.class, () -> usuarios.save(nuevoUsuario("alice", false)));
    }

    @Test
    void historialDevuelveUltimosMensajesEnOrdenAscendente() {
        Usuario alice = usuarios.save(nuevoUsuario("alice", false));
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        for (int i = 1; i <= 5; i++) {
            mensajes.save(MensajeFactory.crearMensajeTexto(null, alice.getId(), null, "m" + i, null, now));
        }

        List<Mensaje> latest = mensajes.findLatest(3);

        assertEquals(3, latest.size());
        assertEquals("m3", latest.get(0).getContenido());
        assertEquals("m5", latest.get(2).getContenido());
        assertTrue(latest.get(0).getId() < latest.get(1).getId());
        assertEquals("alice", latest.get(2).getUsername());
    }

    @Test
    void stickerConRespuestaConservaSusCampos() {
        Usuario bob = usuarios.save(nuevoUsuario("bob", false));
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Mensaje texto = mensajes.save(MensajeFactory.crearMensajeTexto(null, bob.getId(), null, "hola", null, now));
        Mensaje sticker = mensajes.save(MensajeFactory.crearMensajeSticker(null, bob.getId(), null, "thumbs_up", texto.getId(), now));

        Mensaje leido = mensajes.findLatest(10).get(1);

        assertEquals(sticker.getId(), leido.getId());
        assertEquals(TipoMensaje.STICKER, leido.getTipo());
        assertEquals("thumbs_up", leido.getSticker());
        assertEquals("", leido.getContenido());
        assertEquals(texto.getId(), leido.getReplyTo());
        assertNull(mensajes.findLatest(10).get(0).getReplyTo());
        assertEquals(now, leido.getCreatedAt());
    }

    private Usuario nuevoUsuario(String username, boolean admin) {
        return new Usuario(null, username, "hash", admin, true, Instant.now());
    }
}
