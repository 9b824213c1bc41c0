package com.salachat.entidades;

import java.time.Instant;
import java.util.Objects;

/**
 * Mensaje de la sala única. Las instancias son inmutables: el identificador y la
 * fecha los asigna el almacén al insertar.
 */
public abstract class Mensaje {
    private final Long id;
    private final Long userId;
    private final String username;
    private final TipoMensaje tipo;
    private final Long replyTo;
    private final Instant createdAt;

    protected Mensaje(Long id, Long userId, String username, TipoMensaje tipo, Long replyTo, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.username = username;
        this.tipo = Objects.requireNonNull(tipo, "tipo");
        this.replyTo = replyTo;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public TipoMensaje getTipo() {
        return tipo;
    }

    public Long getReplyTo() {
        return replyTo;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Texto del mensaje; vacío para los stickers.
     */
    public abstract String getContenido();

    /**
     * Token del sticker; {@code null} para los mensajes de texto.
     */
    public abstract String getSticker();

    /**
     * Copia del mensaje con el nombre de usuario del emisor.
     */
    public abstract Mensaje conUsername(String username);
}
