package com.salachat.controladores.conexion;

import com.salachat.servicios.conexion.SessionDescriptor;
import com.salachat.servicios.eventos.SessionEvent;
import com.salachat.servicios.eventos.SessionEventBus;
import com.salachat.servicios.eventos.SessionEventType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Conjunto de sesiones vivas de la sala.
 * <p>
 * Todas las mutaciones y lecturas se serializan con un único lock. Los eventos de sesión se
 * publican mientras el lock está tomado, así los observers (presencia, métricas) los reciben
 * en el mismo orden en que se aplicaron los cambios. Los observers pueden volver a llamar al
 * registro desde el mismo hilo porque el lock es reentrante.
 */
public class ConnectionRegistry {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRegistry.class.getName());

    private static final Comparator<String> USERNAME_ORDER =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ClientConnection, ChatSession> sessions = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final SessionEventBus eventBus;

    public ConnectionRegistry(SessionEventBus eventBus) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    public ChatSession register(ClientConnection connection) {
        Objects.requireNonNull(connection, "connection");
        lock.lock();
        try {
            ChatSession session = new ChatSession("session-" + sequence.incrementAndGet(), connection);
            sessions.put(connection, session);
            LOGGER.info(() -> "Nueva conexión registrada " + session.getId() + " desde " + connection.getRemoteAddress());
            eventBus.publish(new SessionEvent(SessionEventType.TCP_CONNECTED, session.getId(), null, session.describe()));
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marca la sesión como autenticada. La transición ocurre una única vez.
     *
     * @throws AlreadyAuthenticatedException si la sesión ya tenía identidad
     */
    public void authenticate(ChatSession session, long userId, String username, boolean admin) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(username, "username");
        lock.lock();
        try {
            if (session.isAuthenticated()) {
                throw new AlreadyAuthenticatedException(session.getId());
            }
            session.bind(new SessionIdentity(userId, username, admin));
            if (sessions.get(session.getConnection()) != session) {
                // La conexión se cerró mientras se validaban las credenciales
                LOGGER.log(Level.FINE, "Sesión {0} autenticada tras cerrarse; no se publica", session.getId());
                return;
            }
            LOGGER.info(() -> "Sesión " + session.getId() + " autenticada como " + username);
            eventBus.publish(new SessionEvent(SessionEventType.LOGIN, session.getId(), userId, session.describe()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Elimina la sesión y cierra su conexión. Llamadas repetidas no tienen efecto.
     *
     * @return {@code true} si la sesión seguía registrada
     */
    public boolean unregister(ChatSession session) {
        if (session == null) {
            return false;
        }
        lock.lock();
        try {
            if (!sessions.remove(session.getConnection(), session)) {
                return false;
            }
            session.getConnection().close();
            SessionDescriptor descriptor = session.describe();
            LOGGER.info(() -> "Sesión removida " + session.getId());
            eventBus.publish(new SessionEvent(SessionEventType.TCP_DISCONNECTED, session.getId(),
                    descriptor.getUserId(), descriptor));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Expulsa la sesión dueña de una conexión que dejó de aceptar frames.
     */
    public boolean evict(ClientConnection connection) {
        if (connection == null) {
            return false;
        }
        lock.lock();
        try {
            ChatSession session = sessions.get(connection);
            if (session == null) {
                connection.close();
                return false;
            }
            LOGGER.log(Level.WARNING, "Expulsando {0}: fallo de entrega", session);
            eventBus.publish(new SessionEvent(SessionEventType.CONNECTION_EVICTED, session.getId(),
                    session.isAuthenticated() ? session.getIdentity().userId() : null, session.describe()));
            return unregister(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Nombres de los usuarios autenticados, sin duplicados y ordenados sin distinguir mayúsculas.
     */
    public List<String> snapshotOnlineUsernames() {
        lock.lock();
        try {
            return sessions.values().stream()
                    .map(ChatSession::getIdentity)
                    .filter(Objects::nonNull)
                    .map(SessionIdentity::username)
                    .distinct()
                    .sorted(USERNAME_ORDER)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ejecuta la acción con el lock del registro tomado. Las difusiones y los cambios de
     * sesión de otros hilos esperan a que termine.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public List<ClientConnection> allConnections() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cierra todas las sesiones, usado al apagar el servidor.
     */
    public void closeAll() {
        List<ChatSession> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
        snapshot.forEach(this::unregister);
        LOGGER.log(Level.INFO, "Cerradas {0} sesiones", snapshot.size());
    }
}
