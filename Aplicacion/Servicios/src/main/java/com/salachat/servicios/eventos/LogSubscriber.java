package com.salachat.servicios.eventos;

import com.salachat.servicios.conexion.SessionDescriptor;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observer que escribe eventos relevantes en el log del servidor.
 */
public class LogSubscriber implements SessionObserver {

    private static final Logger LOGGER = Logger.getLogger(LogSubscriber.class.getName());

    public LogSubscriber(SessionEventBus bus) {
        Objects.requireNonNull(bus, "bus").subscribe(this);
    }

    @Override
    public void onEvent(SessionEvent event) {
        String detalle = describir(event);
        Level level = event.getType() == SessionEventType.MESSAGE_SENT ? Level.FINE : Level.INFO;
        LOGGER.log(level, detalle);
    }

    String describir(SessionEvent event) {
        return switch (event.getType()) {
            case TCP_CONNECTED -> "Nueva conexión TCP - Sesión: " + event.getSessionId() + " desde " + ip(event);
            case LOGIN -> "Login de " + usuario(event) + " - Sesión: " + event.getSessionId();
            case TCP_DISCONNECTED -> "Conexión cerrada - Sesión: " + event.getSessionId() + " (" + usuario(event) + ")";
            case MESSAGE_SENT -> "Mensaje " + event.getPayload() + " enviado por usuario " + event.getActorId();
            case CONNECTION_EVICTED -> "Conexión expulsada por fallo de entrega - Sesión: " + event.getSessionId();
        };
    }

    private static String ip(SessionEvent event) {
        if (event.getPayload() instanceof SessionDescriptor descriptor && descriptor.getIp() != null) {
            return descriptor.getIp();
        }
        return "IP desconocida";
    }

    private static String usuario(SessionEvent event) {
        if (event.getPayload() instanceof SessionDescriptor descriptor && descriptor.getUsername() != null) {
            return descriptor.getUsername();
        }
        return "anónimo";
    }
}
