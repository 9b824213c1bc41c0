package com.salachat.bootstrap;

import com.salachat.bootstrap.config.ServerConfig;
import com.salachat.configdb.DBConfig;
import com.salachat.controladores.conexion.AccessPolicy;
import com.salachat.controladores.conexion.BroadcastEngine;
import com.salachat.controladores.conexion.ConnectionRegistry;
import com.salachat.controladores.conexion.FrameCodec;
import com.salachat.controladores.conexion.PresenceTracker;
import com.salachat.controladores.conexion.ProtocolDispatcher;
import com.salachat.repositorios.MensajeRepository;
import com.salachat.repositorios.UsuarioRepository;
import com.salachat.repositorios.jdbc.DatabaseInitializer;
import com.salachat.repositorios.jdbc.JdbcMensajeRepository;
import com.salachat.repositorios.jdbc.JdbcUsuarioRepository;
import com.salachat.servicios.ChatStore;
import com.salachat.servicios.eventos.LogSubscriber;
import com.salachat.servicios.eventos.SessionEventBus;
import com.salachat.servicios.impl.ChatStoreImpl;
import com.salachat.servicios.metrics.MetricsSessionObserver;
import com.salachat.servicios.metrics.ServerMetrics;
import com.salachat.servicios.security.Pbkdf2PasswordHasher;

import javax.sql.DataSource;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Manual dependency injection for the chat server. It ensures the database schema and the
 * initial administrator exist, then wires the store, the session event bus and the room core
 * (registry, broadcast, presence, dispatcher) behind the TCP listener.
 */
public final class ServidorApplication {

    private static final Logger LOGGER = Logger.getLogger(ServidorApplication.class.getName());

    private final ServerConfig serverConfig;
    private final ChatStore chatStore;
    private final SessionEventBus eventBus;
    private final ConnectionRegistry connectionRegistry;
    private final TCPServer tcpServer;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ServidorApplication(ServerConfig serverConfig, DataSource dataSource, AdminProvisioner.PasswordPrompt prompt) {
        this.serverConfig = Objects.requireNonNull(serverConfig, "serverConfig");
        Objects.requireNonNull(dataSource, "dataSource");
        DatabaseInitializer.ensureSchema(dataSource);

        UsuarioRepository usuarioRepository = new JdbcUsuarioRepository(dataSource);
        MensajeRepository mensajeRepository = new JdbcMensajeRepository(dataSource);
        this.chatStore = new ChatStoreImpl(usuarioRepository, mensajeRepository, new Pbkdf2PasswordHasher());

        new AdminProvisioner(chatStore, prompt)
                .ensureAdmin(serverConfig.getAdminUsername(), serverConfig.getAdminPassword());

        this.eventBus = new SessionEventBus();
        // Observabilidad
        new MetricsSessionObserver(eventBus);
        new LogSubscriber(eventBus);

        this.connectionRegistry = new ConnectionRegistry(eventBus);
        FrameCodec codec = new FrameCodec();
        BroadcastEngine broadcastEngine = new BroadcastEngine(connectionRegistry, codec);
        new PresenceTracker(connectionRegistry, broadcastEngine, eventBus);
        ProtocolDispatcher dispatcher = new ProtocolDispatcher(chatStore, connectionRegistry, broadcastEngine, codec,
                new AccessPolicy(), eventBus, serverConfig.getHistoryLimit());

        this.tcpServer = new TCPServer(
                serverConfig.getHost(),
                serverConfig.getServerPort(),
                serverConfig.getMaxConnections(),
                serverConfig.getMaxFrameBytes(),
                serverConfig.getOutboundQueueCapacity(),
                connectionRegistry,
                dispatcher,
                codec);
    }

    public void start() throws IOException {
        int metricsPort = serverConfig.getMetricsPort();
        if (metricsPort > 0) {
            ServerMetrics.startMetricsServer(metricsPort);
        }
        tcpServer.start();
    }

    /**
     * Cierre ordenado: deja de aceptar conexiones y cierra todas las sesiones.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Iniciando cierre ordenado del servidor...");
        tcpServer.shutdown();
        connectionRegistry.closeAll();
        if (serverConfig.getMetricsPort() > 0) {
            ServerMetrics.stopMetricsServer();
        }
        LOGGER.info("Servidor cerrado correctamente");
    }

    public ConnectionRegistry getConnectionRegistry() {
        return connectionRegistry;
    }

    public SessionEventBus getEventBus() {
        return eventBus;
    }

    public ChatStore getChatStore() {
        return chatStore;
    }

    public TCPServer getTcpServer() {
        return tcpServer;
    }

    static void configureLogging(Level level) {
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.getInstance();
        configureLogging(config.getLogLevel());
        try {
            ServidorApplication application = new ServidorApplication(config,
                    DBConfig.getInstance().getMySqlDataSource(), AdminProvisioner.PasswordPrompt.console());
            Runtime.getRuntime().addShutdownHook(new Thread(application::shutdown, "Server-Shutdown-Hook"));
            application.start();
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "No se pudo iniciar el servidor", e);
            System.exit(1);
        }
    }
}
