package com.salachat.repositorios;

import com.salachat.entidades.Mensaje;

import java.util.List;

public interface MensajeRepository {

    /**
     * Inserta el mensaje y devuelve una copia con el identificador asignado.
     */
    Mensaje save(Mensaje mensaje);

    /**
     * Obtiene los últimos {@code limit} mensajes, ordenados del más antiguo al más nuevo,
     * con el nombre de usuario del emisor.
     */
    List<Mensaje> findLatest(int limit);
}
