package com.salachat.controladores.conexion;

import com.salachat.servicios.conexion.SessionDescriptor;

import java.util.Objects;

public final class ChatSession {

    private final String id;
    private final ClientConnection connection;
    private volatile SessionIdentity identity;

    ChatSession(String id, ClientConnection connection) {
        this.id = Objects.requireNonNull(id, "id");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public String getId() {
        return id;
    }

    public ClientConnection getConnection() {
        return connection;
    }

    public boolean isAuthenticated() {
        return identity != null;
    }

    /**
     * @return la identidad, o {@code null} mientras la sesión no esté autenticada
     */
    public SessionIdentity getIdentity() {
        return identity;
    }

    // Solo el registro la asigna, bajo su lock
    void bind(SessionIdentity identity) {
        this.identity = identity;
    }

    public SessionDescriptor describe() {
        SessionIdentity current = identity;
        if (current == null) {
            return new SessionDescriptor(id, null, null, false, connection.getRemoteAddress());
        }
        return new SessionDescriptor(id, current.userId(), current.username(), current.admin(),
                connection.getRemoteAddress());
    }

    @Override
    public String toString() {
        SessionIdentity current = identity;
        return "ChatSession{" + id + ", usuario=" + (current != null ? current.username() : "anónimo") + '}';
    }
}
