package com.salachat.controladores.conexion;

import com.salachat.servicios.metrics.ServerMetrics;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Conexión TCP con cola de salida acotada y un hilo escritor propio, de modo que un
 * cliente lento no bloquea al resto de la sala.
 */
public class SocketConnection implements ClientConnection {

    private static final Logger LOGGER = Logger.getLogger(SocketConnection.class.getName());

    private final String id;
    private final Socket socket;
    private final String remoteAddress;
    private final BlockingQueue<String> outbound;
    private final Consumer<ClientConnection> onWriteFailure;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final Thread writerThread;

    public SocketConnection(String id, Socket socket, int queueCapacity,
                            Consumer<ClientConnection> onWriteFailure) throws IOException {
        this.id = Objects.requireNonNull(id, "id");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.onWriteFailure = Objects.requireNonNull(onWriteFailure, "onWriteFailure");
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
        BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        this.writerThread = new Thread(() -> drain(writer), "writer-" + id);
        this.writerThread.setDaemon(true);
    }

    public void start() {
        writerThread.start();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getRemoteAddress() {
        return remoteAddress;
    }

    @Override
    public boolean offer(String frame) {
        if (!open.get()) {
            return false;
        }
        boolean accepted = outbound.offer(frame);
        if (!accepted) {
            LOGGER.log(Level.WARNING, "Cola de salida llena para {0} ({1} frames pendientes)",
                    new Object[]{id, outbound.size()});
        }
        return accepted;
    }

    @Override
    public boolean isOpen() {
        return open.get() && !socket.isClosed();
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        writerThread.interrupt();
        outbound.clear();
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error cerrando socket de {0}: {1}", new Object[]{id, e.getMessage()});
        }
    }

    private void drain(BufferedWriter writer) {
        try {
            while (open.get()) {
                String frame = outbound.take();
                writer.write(frame);
                writer.write('\n');
                if (outbound.isEmpty()) {
                    writer.flush();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (open.get()) {
                LOGGER.log(Level.INFO, "Fallo de escritura hacia {0}: {1}", new Object[]{id, e.getMessage()});
                ServerMetrics.onTcpSocketError("write", e);
                onWriteFailure.accept(this);
            }
        }
    }

    @Override
    public String toString() {
        return "SocketConnection{" + id + ", " + remoteAddress + '}';
    }
}
