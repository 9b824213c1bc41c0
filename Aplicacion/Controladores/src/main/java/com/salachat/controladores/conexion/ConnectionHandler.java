package com.salachat.controladores.conexion;

import com.salachat.servicios.metrics.ServerMetrics;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hilo lector de una conexión: registra la sesión, lee frames línea a línea y los entrega
 * al dispatcher hasta que el socket se cierra.
 */
public class ConnectionHandler implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionHandler.class.getName());
    private static final AtomicLong CONNECTION_SEQUENCE = new AtomicLong();

    private final ConnectionRegistry registry;
    private final ProtocolDispatcher dispatcher;
    private final int maxFrameBytes;
    private final int outboundQueueCapacity;
    private ConnectionHandlerPool pool;

    private Socket socket;
    private ChatSession session;

    public ConnectionHandler(ConnectionRegistry registry,
                             ProtocolDispatcher dispatcher,
                             int maxFrameBytes,
                             int outboundQueueCapacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.maxFrameBytes = maxFrameBytes;
        this.outboundQueueCapacity = outboundQueueCapacity;
    }

    public void attach(Socket socket) {
        this.socket = socket;
    }

    public void setPool(ConnectionHandlerPool pool) {
        this.pool = pool;
    }

    @Override
    public void run() {
        try {
            SocketConnection connection = new SocketConnection("conn-" + CONNECTION_SEQUENCE.incrementAndGet(),
                    socket, outboundQueueCapacity, registry::evict);
            session = registry.register(connection);
            connection.start();
            listen(new FrameReader(socket.getInputStream(), maxFrameBytes));
        } catch (SocketException e) {
            // Conexión cerrada por el cliente o expulsada por el registro
            LOGGER.log(Level.FINE, "Cliente desconectado: {0}", e.getMessage());
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error de lectura en la conexión", e);
            ServerMetrics.onTcpSocketError("read", e);
        } finally {
            cleanup();
            if (pool != null) {
                pool.release(this);
            }
        }
    }

    private void listen(FrameReader reader) throws IOException {
        while (true) {
            String line;
            try {
                line = reader.readFrame();
            } catch (FrameTooLargeException e) {
                LOGGER.log(Level.INFO, "{0}: {1}", new Object[]{session.getId(), e.getMessage()});
                dispatcher.rejectOversizedFrame(session);
                continue;
            }
            if (line == null) {
                return;
            }
            if (line.isBlank()) {
                continue;
            }
            dispatcher.dispatch(session, line);
        }
    }

    private void cleanup() {
        if (session != null) {
            registry.unregister(session);
        }
        if (socket != null && !socket.isClosed()) {
            try {
                socket.close();
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Error cerrando socket: {0}", e.getMessage());
            }
        }
        this.socket = null;
        this.session = null;
    }
}
