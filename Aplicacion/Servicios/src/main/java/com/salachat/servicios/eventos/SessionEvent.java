package com.salachat.servicios.eventos;

import java.time.Instant;
import java.util.Objects;

/**
 * Evento emitido cuando ocurre una acción relevante en una sesión del servidor.
 */
public final class SessionEvent {

    private final SessionEventType type;
    private final String sessionId;
    private final Long actorId;
    private final Object payload;
    private final Instant timestamp;

    public SessionEvent(SessionEventType type, String sessionId, Long actorId, Object payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.sessionId = sessionId;
        this.actorId = actorId;
        this.payload = payload;
        this.timestamp = Instant.now();
    }

    public SessionEventType getType() {
        return type;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Long getActorId() {
        return actorId;
    }

    public Object getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "SessionEvent{" + type + ", session=" + sessionId + ", actor=" + actorId + '}';
    }
}
