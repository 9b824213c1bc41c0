package com.salachat.servicios.metrics;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.HTTPServer;

import java.io.IOException;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Métricas Prometheus de la sala. El endpoint HTTP es opcional y se arranca desde el bootstrap.
 */
public final class ServerMetrics {

    private static final Logger LOGGER = Logger.getLogger(ServerMetrics.class.getName());

    private static volatile HTTPServer httpServer;

    // --- Conexiones ---

    private static final Gauge tcpActiveConnections = Gauge.build()
        .name("sala_tcp_active_connections")
        .help("Conexiones TCP registradas en este momento.")
        .register();

    private static final Counter tcpConnectionEvents = Counter.build()
        .name("sala_tcp_connection_events_total")
        .help("Eventos de ciclo de vida de conexiones TCP.")
        .labelNames("event")
        .register();

    private static final Counter tcpSocketErrors = Counter.build()
        .name("sala_tcp_socket_errors_total")
        .help("Errores de socket por fase.")
        .labelNames("phase", "exception")
        .register();

    // --- Frames del protocolo ---

    private static final Counter framesTotal = Counter.build()
        .name("sala_frames_total")
        .help("Frames de cliente procesados por tipo y resultado.")
        .labelNames("type", "result")
        .register();

    private static final Histogram frameLatency = Histogram.build()
        .name("sala_frame_latency_seconds")
        .help("Tiempo de procesamiento de un frame de cliente.")
        .labelNames("type")
        .buckets(0.001, 0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
        .register();

    // --- Autenticación ---

    private static final Counter loginAttempts = Counter.build()
        .name("sala_login_attempts_total")
        .help("Intentos de login por resultado.")
        .labelNames("result")
        .register();

    private static final Gauge authenticatedSessions = Gauge.build()
        .name("sala_authenticated_sessions")
        .help("Sesiones autenticadas activas.")
        .register();

    // --- Difusión ---

    private static final Counter broadcasts = Counter.build()
        .name("sala_broadcasts_total")
        .help("Frames difundidos a toda la sala por tipo.")
        .labelNames("type")
        .register();

    private static final Counter evictions = Counter.build()
        .name("sala_evictions_total")
        .help("Conexiones expulsadas por fallo de entrega.")
        .register();

    private static final Histogram historySize = Histogram.build()
        .name("sala_history_messages")
        .help("Mensajes enviados en el historial tras el login.")
        .buckets(0, 10, 20, 40, 60, 80)
        .register();

    private ServerMetrics() {
    }

    /**
     * Arranca el endpoint HTTP de Prometheus. Idempotente.
     */
    public static synchronized void startMetricsServer(int port) {
        if (httpServer != null) {
            return;
        }
        try {
            httpServer = new HTTPServer(port);
            LOGGER.info(() -> "Servidor de metricas Prometheus escuchando en puerto " + port);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "No se pudo iniciar el servidor de metricas en el puerto " + port, e);
        }
    }

    public static synchronized void stopMetricsServer() {
        if (httpServer != null) {
            httpServer.close();
            httpServer = null;
        }
    }

    public static void onTcpSessionRegistered() {
        tcpActiveConnections.inc();
        tcpConnectionEvents.labels("registered").inc();
    }

    public static void onTcpSessionUnregistered() {
        tcpActiveConnections.dec();
        tcpConnectionEvents.labels("unregistered").inc();
    }

    public static void onTcpConnectionRejected(String reason) {
        tcpConnectionEvents.labels(normalizeLabel(reason)).inc();
    }

    public static void onTcpSocketError(String phase, Exception exception) {
        String exName = exception != null ? exception.getClass().getSimpleName() : "Unknown";
        tcpSocketErrors.labels(normalizeLabel(phase), exName).inc();
    }

    public static Histogram.Timer startFrameTimer(String type) {
        return frameLatency.labels(normalizeType(type)).startTimer();
    }

    public static void finishFrame(String type, String result, Histogram.Timer timer) {
        framesTotal.labels(normalizeType(type), normalizeLabel(result)).inc();
        if (timer != null) {
            timer.observeDuration();
        }
    }

    public static void recordLoginSuccess() {
        loginAttempts.labels("success").inc();
    }

    public static void recordLoginFailure() {
        loginAttempts.labels("failure").inc();
    }

    public static void onSessionAuthenticated() {
        authenticatedSessions.inc();
    }

    public static void onAuthenticatedSessionClosed() {
        authenticatedSessions.dec();
    }

    public static void recordBroadcast(String type) {
        broadcasts.labels(normalizeType(type)).inc();
    }

    public static void recordEviction() {
        evictions.inc();
    }

    public static void observeHistorySize(int messages) {
        historySize.observe(messages);
    }

    private static String normalizeType(String type) {
        if (type == null || type.isBlank()) {
            return "unknown";
        }
        // Los tipos desconocidos comparten etiqueta para no disparar la cardinalidad
        String t = type.trim().toLowerCase(Locale.ROOT);
        return t.matches("[a-z_]{1,32}") ? t : "other";
    }

    private static String normalizeLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return "unknown";
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_");
        if (normalized.isEmpty()) {
            return "unknown";
        }
        return normalized.length() > 64 ? normalized.substring(0, 64) : normalized;
    }
}
