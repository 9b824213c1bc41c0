package com.salachat.servicios.metrics;

import com.salachat.servicios.conexion.SessionDescriptor;
import com.salachat.servicios.eventos.SessionEvent;
import com.salachat.servicios.eventos.SessionEventBus;
import com.salachat.servicios.eventos.SessionObserver;

import java.util.Objects;

/**
 * Traduce eventos de sesión a métricas Prometheus.
 */
public class MetricsSessionObserver implements SessionObserver {

    public MetricsSessionObserver(SessionEventBus eventBus) {
        Objects.requireNonNull(eventBus, "eventBus").subscribe(this);
    }

    @Override
    public void onEvent(SessionEvent event) {
        if (event == null) {
            return;
        }
        switch (event.getType()) {
            case TCP_CONNECTED -> ServerMetrics.onTcpSessionRegistered();
            case TCP_DISCONNECTED -> {
                ServerMetrics.onTcpSessionUnregistered();
                if (event.getPayload() instanceof SessionDescriptor descriptor && descriptor.isAuthenticated()) {
                    ServerMetrics.onAuthenticatedSessionClosed();
                }
            }
            case LOGIN -> ServerMetrics.onSessionAuthenticated();
            case CONNECTION_EVICTED -> ServerMetrics.recordEviction();
            default -> {
                // MESSAGE_SENT se mide como broadcast
            }
        }
    }
}
