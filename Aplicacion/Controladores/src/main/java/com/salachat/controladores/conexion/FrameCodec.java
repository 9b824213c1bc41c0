package com.salachat.controladores.conexion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.salachat.dto.MessageDto;
import com.salachat.dto.ServerFrame;
import com.salachat.entidades.Mensaje;

/**
 * Traduce entre líneas JSON del protocolo y objetos del servidor.
 */
public class FrameCodec {

    private static final String MASK = "*******";

    private final ObjectMapper mapper;

    public FrameCodec() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public String encode(ServerFrame frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar el frame " + frame.getType(), e);
        }
    }

    public JsonNode parse(String line) throws JsonProcessingException {
        return mapper.readTree(line);
    }

    public <T> T bind(JsonNode node, Class<T> type) throws JsonProcessingException {
        return mapper.treeToValue(node, type);
    }

    public MessageDto toDto(Mensaje mensaje) {
        return new MessageDto(
                mensaje.getId(),
                mensaje.getUserId(),
                mensaje.getUsername(),
                mensaje.getTipo().getWireName(),
                mensaje.getSticker(),
                mensaje.getReplyTo(),
                mensaje.getContenido(),
                mensaje.getCreatedAt());
    }

    /**
     * Copia del frame apta para el log, con la contraseña oculta.
     */
    public String sanitizeForLog(JsonNode node) {
        if (node == null) {
            return "null";
        }
        JsonNode copy = node.deepCopy();
        if (copy instanceof ObjectNode objectNode && objectNode.has("password")) {
            objectNode.put("password", MASK);
        }
        return copy.toString();
    }
}
