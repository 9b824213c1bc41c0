package com.salachat.controladores.conexion;

import com.salachat.dto.PresenceFrame;
import com.salachat.servicios.conexion.SessionDescriptor;
import com.salachat.servicios.eventos.SessionEvent;
import com.salachat.servicios.eventos.SessionEventBus;
import com.salachat.servicios.eventos.SessionObserver;

import java.util.Objects;

/**
 * Recalcula la lista de usuarios en línea y la difunde cada vez que una sesión se autentica
 * o una sesión autenticada se cierra.
 */
public class PresenceTracker implements SessionObserver {

    private final ConnectionRegistry registry;
    private final BroadcastEngine broadcastEngine;

    public PresenceTracker(ConnectionRegistry registry, BroadcastEngine broadcastEngine, SessionEventBus eventBus) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.broadcastEngine = Objects.requireNonNull(broadcastEngine, "broadcastEngine");
        Objects.requireNonNull(eventBus, "eventBus").subscribe(this);
    }

    @Override
    public void onEvent(SessionEvent event) {
        switch (event.getType()) {
            case LOGIN -> publishPresence();
            case TCP_DISCONNECTED -> {
                if (event.getPayload() instanceof SessionDescriptor descriptor && descriptor.isAuthenticated()) {
                    publishPresence();
                }
            }
            default -> {
            }
        }
    }

    public PresenceFrame currentPresence() {
        return new PresenceFrame(registry.snapshotOnlineUsernames());
    }

    public void publishPresence() {
        broadcastEngine.broadcast(currentPresence());
    }
}
