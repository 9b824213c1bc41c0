package com.salachat.servicios.impl;

import com.salachat.entidades.Mensaje;
import com.salachat.entidades.MensajeFactory;
import com.salachat.entidades.TipoMensaje;
import com.salachat.entidades.Usuario;
import com.salachat.repositorios.DuplicateUsernameException;
import com.salachat.repositorios.MensajeRepository;
import com.salachat.repositorios.UsuarioRepository;
import com.salachat.servicios.ChatStore;
import com.salachat.servicios.ValidationException;
import com.salachat.servicios.security.PasswordHasher;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ChatStoreImpl implements ChatStore {

    private static final Logger LOGGER = Logger.getLogger(ChatStoreImpl.class.getName());

    public static final int MAX_CONTENT_LENGTH = 2000;
    public static final int MAX_HISTORY = 200;
    public static final int MAX_STICKER_LENGTH = 64;

    private final UsuarioRepository usuarioRepository;
    private final MensajeRepository mensajeRepository;
    private final PasswordHasher passwordHasher;

    public ChatStoreImpl(UsuarioRepository usuarioRepository,
                         MensajeRepository mensajeRepository,
                         PasswordHasher passwordHasher) {
        this.usuarioRepository = Objects.requireNonNull(usuarioRepository, "usuarioRepository");
        this.mensajeRepository = Objects.requireNonNull(mensajeRepository, "mensajeRepository");
        this.passwordHasher = Objects.requireNonNull(passwordHasher, "passwordHasher");
    }

    @Override
    public Optional<Usuario> authenticate(String username, String password) {
        String nombre = username == null ? "" : username.trim();
        if (nombre.isEmpty()) {
            return Optional.empty();
        }
        Optional<Usuario> usuario = usuarioRepository.findByUsername(nombre);
        if (usuario.isEmpty()) {
            LOGGER.log(Level.FINE, "Login fallido: usuario {0} no existe", nombre);
            return Optional.empty();
        }
        if (!usuario.get().isActive()) {
            LOGGER.log(Level.INFO, "Login rechazado: usuario {0} inactivo", nombre);
            return Optional.empty();
        }
        if (!passwordHasher.matches(password == null ? "" : password, usuario.get().getPasswordHash())) {
            LOGGER.log(Level.FINE, "Login fallido: contraseña incorrecta para {0}", nombre);
            return Optional.empty();
        }
        return usuario;
    }

    @Override
    public long createUser(String username, String password, boolean admin) {
        String nombre = username == null ? "" : username.trim();
        if (nombre.length() < 3 || nombre.length() > 32 || contieneEspacios(nombre)) {
            throw new ValidationException("Username must be 3..32 chars, no spaces");
        }
        if (password == null || password.length() < 4) {
            throw new ValidationException("Password must be at least 4 chars");
        }
        Usuario usuario = new Usuario(null, nombre, passwordHasher.hash(password), admin, true,
                Instant.now().truncatedTo(ChronoUnit.MILLIS));
        try {
            Usuario guardado = usuarioRepository.save(usuario);
            LOGGER.log(Level.INFO, "Usuario {0} creado (admin={1})", new Object[]{nombre, admin});
            return guardado.getId();
        } catch (DuplicateUsernameException e) {
            throw new ValidationException("Username already exists", e);
        }
    }

    @Override
    public Mensaje insertMessage(long userId, String content, TipoMensaje tipo, String sticker, Long replyTo) {
        TipoMensaje kind = tipo != null ? tipo : TipoMensaje.TEXT;
        String contenido = content == null ? "" : content.trim();
        if (kind == TipoMensaje.TEXT && contenido.isEmpty()) {
            throw new ValidationException("Empty message");
        }
        if (contenido.length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("Message is too long (max " + MAX_CONTENT_LENGTH + " chars)");
        }
        String stickerLimpio = null;
        if (kind == TipoMensaje.STICKER) {
            stickerLimpio = sticker == null ? "" : sticker.trim();
            if (stickerLimpio.isEmpty()) {
                throw new ValidationException("Sticker is empty");
            }
            if (stickerLimpio.length() > MAX_STICKER_LENGTH) {
                throw new ValidationException("Sticker is too long (max " + MAX_STICKER_LENGTH + " chars)");
            }
        }
        Mensaje mensaje = MensajeFactory.crearMensaje(kind, null, userId, null, contenido, stickerLimpio, replyTo,
                Instant.now().truncatedTo(ChronoUnit.MILLIS));
        Mensaje guardado = mensajeRepository.save(mensaje);
        LOGGER.fine(() -> "Mensaje " + guardado.getId() + " guardado para usuario " + userId);
        return guardado;
    }

    @Override
    public List<Mensaje> fetchHistory(int limit) {
        int acotado = Math.max(1, Math.min(MAX_HISTORY, limit));
        return mensajeRepository.findLatest(acotado);
    }

    @Override
    public Optional<Usuario> findUser(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        return usuarioRepository.findByUsername(username.trim());
    }

    private static boolean contieneEspacios(String value) {
        return value.chars().anyMatch(Character::isWhitespace);
    }
}
