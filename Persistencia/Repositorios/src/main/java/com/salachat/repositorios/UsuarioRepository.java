package com.salachat.repositorios;

import com.salachat.entidades.Usuario;

import java.util.Optional;

/**
 * Acceso a datos para entidades {@link Usuario}.
 */
public interface UsuarioRepository {

    /**
     * Inserta un usuario nuevo y le asigna el identificador generado.
     *
     * @throws DuplicateUsernameException si el nombre de usuario ya existe
     */
    Usuario save(Usuario usuario);

    Optional<Usuario> findById(Long id);

    Optional<Usuario> findByUsername(String username);
}
