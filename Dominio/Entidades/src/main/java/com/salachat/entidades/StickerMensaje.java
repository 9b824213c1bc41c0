package com.salachat.entidades;

import java.time.Instant;

public class StickerMensaje extends Mensaje {
    private final String sticker;

    public StickerMensaje(Long id, Long userId, String username, String sticker, Long replyTo, Instant createdAt) {
        super(id, userId, username, TipoMensaje.STICKER, replyTo, createdAt);
        this.sticker = sticker;
    }

    @Override
    public String getContenido() {
        return "";
    }

    @Override
    public String getSticker() {
        return sticker;
    }

    @Override
    public StickerMensaje conUsername(String username) {
        return new StickerMensaje(getId(), getUserId(), username, sticker, getReplyTo(), getCreatedAt());
    }
}
