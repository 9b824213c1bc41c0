package com.salachat.entidades;

import java.time.Instant;

public class TextoMensaje extends Mensaje {
    private final String contenido;

    public TextoMensaje(Long id, Long userId, String username, String contenido, Long replyTo, Instant createdAt) {
        super(id, userId, username, TipoMensaje.TEXT, replyTo, createdAt);
        this.contenido = contenido;
    }

    @Override
    public String getContenido() {
        return contenido;
    }

    @Override
    public String getSticker() {
        return null;
    }

    @Override
    public TextoMensaje conUsername(String username) {
        return new TextoMensaje(getId(), getUserId(), username, contenido, getReplyTo(), getCreatedAt());
    }
}
