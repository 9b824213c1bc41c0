package com.salachat.controladores.conexion;

import java.net.Socket;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.function.Supplier;

/**
 * Conjunto fijo de handlers; limita cuántas conexiones se atienden a la vez.
 */
public class ConnectionHandlerPool {

    private final Queue<ConnectionHandler> pool;
    private final int capacity;

    public ConnectionHandlerPool(int capacity, Supplier<ConnectionHandler> factory) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity debe ser positivo");
        }
        this.capacity = capacity;
        this.pool = new ArrayBlockingQueue<>(capacity);
        for (int i = 0; i < capacity; i++) {
            ConnectionHandler handler = factory.get();
            handler.setPool(this);
            pool.add(handler);
        }
    }

    /**
     * @return un handler asociado al socket, o {@code null} si no quedan libres
     */
    public synchronized ConnectionHandler acquire(Socket socket) {
        ConnectionHandler handler = pool.poll();
        if (handler == null) {
            return null;
        }
        handler.attach(socket);
        return handler;
    }

    public synchronized void release(ConnectionHandler handler) {
        if (handler != null) {
            pool.offer(handler);
        }
    }

    public synchronized int available() {
        return pool.size();
    }

    public int capacity() {
        return capacity;
    }
}
