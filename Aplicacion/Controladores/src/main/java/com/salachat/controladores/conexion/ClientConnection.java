package com.salachat.controladores.conexion;

/**
 * Canal de salida hacia un cliente. Los frames se encolan ya codificados y
 * se escriben en orden de llegada.
 */
public interface ClientConnection {

    String getId();

    String getRemoteAddress();

    /**
     * Encola un frame sin bloquear.
     *
     * @return {@code false} si la conexión está cerrada o su cola de salida está llena
     */
    boolean offer(String frame);

    boolean isOpen();

    /**
     * Cierra la conexión. Idempotente.
     */
    void close();
}
