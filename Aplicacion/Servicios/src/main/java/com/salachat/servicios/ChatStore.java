package com.salachat.servicios;

import com.salachat.entidades.Mensaje;
import com.salachat.entidades.TipoMensaje;
import com.salachat.entidades.Usuario;

import java.util.List;
import java.util.Optional;

/**
 * Almacén de credenciales y mensajes que consume el núcleo de la sala.
 */
public interface ChatStore {

    /**
     * Valida las credenciales. Devuelve vacío si el usuario no existe, está inactivo
     * o la contraseña no coincide.
     */
    Optional<Usuario> authenticate(String username, String password);

    /**
     * Crea un usuario nuevo y devuelve su identificador.
     *
     * @throws ValidationException con un mensaje legible para el cliente
     */
    long createUser(String username, String password, boolean admin);

    /**
     * Persiste un mensaje. El resultado no incluye el nombre de usuario del emisor.
     *
     * @throws ValidationException si el contenido o el sticker no son válidos
     */
    Mensaje insertMessage(long userId, String content, TipoMensaje tipo, String sticker, Long replyTo);

    /**
     * Últimos {@code limit} mensajes (acotado a 1..200) en orden cronológico.
     */
    List<Mensaje> fetchHistory(int limit);

    Optional<Usuario> findUser(String username);
}
