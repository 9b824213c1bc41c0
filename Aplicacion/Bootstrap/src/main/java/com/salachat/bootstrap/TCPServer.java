package com.salachat.bootstrap;

import com.salachat.controladores.conexion.ConnectionHandler;
import com.salachat.controladores.conexion.ConnectionHandlerPool;
import com.salachat.controladores.conexion.ConnectionRegistry;
import com.salachat.controladores.conexion.FrameCodec;
import com.salachat.controladores.conexion.ProtocolDispatcher;
import com.salachat.dto.ErrorFrame;
import com.salachat.servicios.metrics.ServerMetrics;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP Server that listens for client connections and delegates handling
 * to ConnectionHandler instances from a pool.
 */
public class TCPServer implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(TCPServer.class.getName());

    private final String host;
    private final int port;
    private final ConnectionRegistry registry;
    private final ConnectionHandlerPool pool;
    private final FrameCodec codec;
    private final ExecutorService executor;

    private ServerSocket serverSocket;
    private volatile boolean running = false;

    public TCPServer(String host,
                     int port,
                     int maxConnections,
                     int maxFrameBytes,
                     int outboundQueueCapacity,
                     ConnectionRegistry registry,
                     ProtocolDispatcher dispatcher,
                     FrameCodec codec) {
        this.host = host;
        this.port = port;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(dispatcher, "dispatcher");
        this.pool = new ConnectionHandlerPool(maxConnections,
                () -> new ConnectionHandler(registry, dispatcher, maxFrameBytes, outboundQueueCapacity));
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "reader");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Abre el puerto y arranca el hilo que acepta conexiones.
     */
    public void start() throws IOException {
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port));
        running = true;
        LOGGER.log(Level.INFO, "Servidor TCP iniciado en {0}:{1}",
                new Object[]{host, String.valueOf(serverSocket.getLocalPort())});
        Thread serverThread = new Thread(this, "TCP-Server");
        serverThread.start();
    }

    @Override
    public void run() {
        while (running) {
            try {
                Socket clientSocket = serverSocket.accept();
                String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());
                ConnectionHandler handler = pool.acquire(clientSocket);
                if (handler == null) {
                    LOGGER.log(Level.WARNING, "Conexión rechazada desde {0} - Límite alcanzado ({1} conexiones)",
                            new Object[]{clientAddress, pool.capacity()});
                    ServerMetrics.onTcpConnectionRejected("pool_exhausted");
                    reject(clientSocket);
                    continue;
                }
                LOGGER.log(Level.FINE, "Nueva conexión desde {0} ({1}/{2} conexiones)",
                        new Object[]{clientAddress, registry.size() + 1, pool.capacity()});
                executor.execute(handler);
            } catch (IOException e) {
                if (running) {
                    LOGGER.log(Level.WARNING, "Error aceptando conexión", e);
                    ServerMetrics.onTcpSocketError("accept", e);
                }
            }
        }
    }

    private void reject(Socket clientSocket) {
        try (Socket socket = clientSocket) {
            OutputStream out = socket.getOutputStream();
            out.write((codec.encode(new ErrorFrame("Server is full")) + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "No se pudo notificar el rechazo: {0}", e.getMessage());
        }
    }

    public void shutdown() {
        running = false;
        if (serverSocket != null && !serverSocket.isClosed()) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Error cerrando ServerSocket", e);
            }
        }
        executor.shutdown();
        LOGGER.log(Level.INFO, "Servidor TCP detenido");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Puerto efectivo; útil cuando se configura el puerto 0.
     */
    public int getLocalPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : port;
    }
}
