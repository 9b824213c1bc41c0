package com.salachat.entidades;

import java.util.Locale;
import java.util.Optional;

/**
 * Tipos de mensaje admitidos en la sala.
 */
public enum TipoMensaje {
    TEXT("text"),
    STICKER("sticker");

    private final String wireName;

    TipoMensaje(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resuelve el tipo a partir de su nombre en el protocolo, sin distinguir mayúsculas.
     *
     * @param value nombre recibido del cliente; {@code null} o vacío equivale a {@code text}.
     * @return el tipo, o vacío si el nombre no corresponde a ninguno.
     */
    public static Optional<TipoMensaje> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(TEXT);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TipoMensaje tipo : values()) {
            if (tipo.wireName.equals(normalized)) {
                return Optional.of(tipo);
            }
        }
        return Optional.empty();
    }
}
