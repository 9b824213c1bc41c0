package com.salachat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Base de todos los frames que el servidor envía a los clientes.
 */
@JsonPropertyOrder({"type"})
public abstract class ServerFrame {

    private final String type;

    protected ServerFrame(String type) {
        this.type = type;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }
}
