package com.salachat.entidades;

import java.time.Instant;

/**
 * Patrón Factory para crear el subtipo de {@link Mensaje} que corresponde a cada {@link TipoMensaje}.
 */
public final class MensajeFactory {

    private MensajeFactory() {
    }

    /**
     * Crea un mensaje de texto ya persistido.
     */
    public static TextoMensaje crearMensajeTexto(Long id, Long userId, String username, String contenido,
                                                 Long replyTo, Instant createdAt) {
        return new TextoMensaje(id, userId, username, contenido, replyTo, createdAt);
    }

    /**
     * Crea un mensaje de sticker ya persistido.
     */
    public static StickerMensaje crearMensajeSticker(Long id, Long userId, String username, String sticker,
                                                     Long replyTo, Instant createdAt) {
        return new StickerMensaje(id, userId, username, sticker, replyTo, createdAt);
    }

    /**
     * Crea un mensaje según el tipo especificado.
     *
     * @param tipo tipo de mensaje a crear
     * @param contenido texto del mensaje, ignorado para stickers
     * @param sticker token del sticker, ignorado para texto
     * @return una instancia del subtipo solicitado
     */
    public static Mensaje crearMensaje(TipoMensaje tipo, Long id, Long userId, String username,
                                       String contenido, String sticker, Long replyTo, Instant createdAt) {
        return switch (tipo) {
            case TEXT -> crearMensajeTexto(id, userId, username, contenido, replyTo, createdAt);
            case STICKER -> crearMensajeSticker(id, userId, username, sticker, replyTo, createdAt);
        };
    }
}
