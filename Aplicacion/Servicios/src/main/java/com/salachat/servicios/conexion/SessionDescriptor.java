package com.salachat.servicios.conexion;

/**
 * Vista inmutable de una sesión en el momento en que se emite un evento.
 */
public class SessionDescriptor {

    private final String sessionId;
    private final Long userId;
    private final String username;
    private final boolean admin;
    private final String ip;

    public SessionDescriptor(String sessionId, Long userId, String username, boolean admin, String ip) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.username = username;
        this.admin = admin;
        this.ip = ip;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Long getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public boolean isAdmin() {
        return admin;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public String getIp() {
        return ip;
    }

    @Override
    public String toString() {
        return "SessionDescriptor{" + sessionId + ", usuario=" + username + ", ip=" + ip + '}';
    }
}
