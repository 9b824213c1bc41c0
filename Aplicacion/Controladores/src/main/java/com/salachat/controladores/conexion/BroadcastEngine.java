package com.salachat.controladores.conexion;

import com.salachat.dto.ServerFrame;
import com.salachat.servicios.metrics.ServerMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Difunde un frame a todas las conexiones vivas. Codifica una sola vez y nunca bloquea:
 * las conexiones que no aceptan el frame se expulsan al terminar la vuelta.
 */
public class BroadcastEngine {

    private static final Logger LOGGER = Logger.getLogger(BroadcastEngine.class.getName());

    private final ConnectionRegistry registry;
    private final FrameCodec codec;

    public BroadcastEngine(ConnectionRegistry registry, FrameCodec codec) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @return número de conexiones que aceptaron el frame
     */
    public int broadcast(ServerFrame frame) {
        String encoded = codec.encode(frame);
        List<ClientConnection> failed = new ArrayList<>();
        int delivered = 0;
        for (ClientConnection connection : registry.allConnections()) {
            if (connection.offer(encoded)) {
                delivered++;
            } else {
                failed.add(connection);
            }
        }
        ServerMetrics.recordBroadcast(frame.getType());
        int total = delivered;
        LOGGER.log(Level.FINE, () -> "Broadcast " + frame.getType() + " entregado a " + total + " conexiones");
        for (ClientConnection connection : failed) {
            registry.evict(connection);
        }
        return delivered;
    }
}
