package com.salachat.bootstrap;

import com.salachat.entidades.Usuario;
import com.salachat.servicios.ChatStore;

import java.io.Console;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Crea el administrador inicial en el primer arranque si todavía no existe.
 */
public class AdminProvisioner {

    private static final Logger LOGGER = Logger.getLogger(AdminProvisioner.class.getName());

    /**
     * Fuente interactiva de la contraseña del administrador.
     */
    @FunctionalInterface
    public interface PasswordPrompt {

        Optional<String> read(String username);

        static PasswordPrompt console() {
            return username -> {
                Console console = System.console();
                if (console == null) {
                    return Optional.empty();
                }
                char[] password = console.readPassword("Contraseña para '%s': ", username);
                return password == null ? Optional.empty() : Optional.of(new String(password));
            };
        }

        static PasswordPrompt none() {
            return username -> Optional.empty();
        }
    }

    private final ChatStore store;
    private final PasswordPrompt prompt;

    public AdminProvisioner(ChatStore store, PasswordPrompt prompt) {
        this.store = Objects.requireNonNull(store, "store");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
    }

    /**
     * @param username          nombre del administrador; vacío desactiva el aprovisionamiento
     * @param configuredPassword contraseña configurada, o {@code null} para pedirla
     * @return {@code true} si se creó el usuario
     * @throws IllegalStateException si hace falta crear el usuario y no hay contraseña
     */
    public boolean ensureAdmin(String username, String configuredPassword) {
        String nombre = username == null ? "" : username.trim();
        if (nombre.isEmpty()) {
            LOGGER.fine("Aprovisionamiento de administrador deshabilitado");
            return false;
        }
        Optional<Usuario> existente = store.findUser(nombre);
        if (existente.isPresent()) {
            if (!existente.get().isAdmin()) {
                LOGGER.log(Level.WARNING, "El usuario {0} existe pero no es administrador", nombre);
            }
            return false;
        }
        LOGGER.log(Level.INFO, "Primer arranque: creando administrador {0}", nombre);
        String password = configuredPassword;
        if (password == null || password.isEmpty()) {
            password = prompt.read(nombre).orElse("");
        }
        if (password.isEmpty()) {
            throw new IllegalStateException("Empty password for initial admin '" + nombre + "'");
        }
        store.createUser(nombre, password, true);
        LOGGER.log(Level.INFO, "Administrador {0} creado", nombre);
        return true;
    }
}
