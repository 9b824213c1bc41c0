package com.salachat.controladores.conexion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.salachat.dto.AdminCreateUserErrorFrame;
import com.salachat.dto.AdminCreateUserOkFrame;
import com.salachat.dto.AdminCreateUserRequest;
import com.salachat.dto.ErrorFrame;
import com.salachat.dto.FrameTypes;
import com.salachat.dto.HistoryFrame;
import com.salachat.dto.LoginErrorFrame;
import com.salachat.dto.LoginOkFrame;
import com.salachat.dto.LoginRequest;
import com.salachat.dto.MessageDto;
import com.salachat.dto.MessageFrame;
import com.salachat.dto.PresenceFrame;
import com.salachat.dto.SendRequest;
import com.salachat.dto.ServerFrame;
import com.salachat.entidades.Mensaje;
import com.salachat.entidades.TipoMensaje;
import com.salachat.entidades.Usuario;
import com.salachat.servicios.ChatStore;
import com.salachat.servicios.ValidationException;
import com.salachat.servicios.eventos.SessionEvent;
import com.salachat.servicios.eventos.SessionEventBus;
import com.salachat.servicios.eventos.SessionEventType;
import com.salachat.servicios.metrics.ServerMetrics;
import io.prometheus.client.Histogram;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Interpreta los frames de un cliente según el estado de su sesión y produce las respuestas
 * y difusiones correspondientes. Cada frame se procesa completo antes del siguiente de la
 * misma conexión.
 */
public class ProtocolDispatcher {

    private static final Logger LOGGER = Logger.getLogger(ProtocolDispatcher.class.getName());

    public static final int MAX_HISTORY = 80;

    static final String INVALID_JSON = "Invalid JSON";
    static final String LOGIN_REQUIRED = "Please login first";
    static final String INVALID_CREDENTIALS = "Invalid credentials or inactive user";
    static final String ALREADY_LOGGED_IN = "Already logged in";
    static final String ADMIN_ONLY = "Admin only";
    static final String ROOMS_DISABLED = "Rooms are disabled. Single chat only.";
    static final String FRAME_TOO_LARGE = "Frame too large";
    static final String INTERNAL_ERROR = "Internal server error";

    private final ChatStore store;
    private final ConnectionRegistry registry;
    private final BroadcastEngine broadcastEngine;
    private final FrameCodec codec;
    private final AccessPolicy accessPolicy;
    private final SessionEventBus eventBus;
    private final int historyLimit;

    public ProtocolDispatcher(ChatStore store,
                              ConnectionRegistry registry,
                              BroadcastEngine broadcastEngine,
                              FrameCodec codec,
                              AccessPolicy accessPolicy,
                              SessionEventBus eventBus,
                              int historyLimit) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.broadcastEngine = Objects.requireNonNull(broadcastEngine, "broadcastEngine");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.accessPolicy = Objects.requireNonNull(accessPolicy, "accessPolicy");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.historyLimit = Math.max(1, Math.min(MAX_HISTORY, historyLimit));
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    /**
     * Procesa una línea recibida de la sesión. Nunca lanza: cualquier fallo termina en una
     * respuesta de error y la conexión sigue abierta.
     */
    public void dispatch(ChatSession session, String rawFrame) {
        JsonNode node;
        try {
            node = codec.parse(rawFrame);
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.FINE, "JSON inválido en {0}: {1}", new Object[]{session.getId(), e.getOriginalMessage()});
            ServerMetrics.finishFrame("invalid", "invalid_json", null);
            reply(session, new ErrorFrame(INVALID_JSON));
            return;
        }
        if (node == null || !node.isObject()) {
            ServerMetrics.finishFrame("invalid", "invalid_json", null);
            reply(session, new ErrorFrame(INVALID_JSON));
            return;
        }

        String type = node.path("type").asText("");
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "Frame de {0}: {1}", new Object[]{session.getId(), codec.sanitizeForLog(node)});
        }

        Histogram.Timer timer = ServerMetrics.startFrameTimer(type);
        String result;
        try {
            AccessDecision decision = accessPolicy.decide(type, session);
            result = switch (decision) {
                case UNAUTHENTICATED -> {
                    reply(session, new ErrorFrame(LOGIN_REQUIRED));
                    yield "unauthenticated";
                }
                case FORBIDDEN -> {
                    reply(session, forbidden(type));
                    yield "forbidden";
                }
                case AUTHORIZED -> route(session, type, node, node.hasNonNull("type"));
            };
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.FINE, "Payload de {0} no válido: {1}", new Object[]{type, e.getOriginalMessage()});
            reply(session, new ErrorFrame(INVALID_JSON));
            result = "invalid_json";
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Error procesando frame " + type + " de " + session.getId(), e);
            reply(session, new ErrorFrame(INTERNAL_ERROR));
            result = "internal_error";
        }
        ServerMetrics.finishFrame(type, result, timer);
    }

    /**
     * Respuesta a una línea descartada por exceder el tamaño máximo.
     */
    public void rejectOversizedFrame(ChatSession session) {
        ServerMetrics.finishFrame("oversized", "frame_too_large", null);
        reply(session, new ErrorFrame(FRAME_TOO_LARGE));
    }

    private String route(ChatSession session, String type, JsonNode node, boolean typed)
            throws JsonProcessingException {
        return switch (type) {
            case FrameTypes.LOGIN -> handleLogin(session, codec.bind(node, LoginRequest.class));
            case FrameTypes.SEND -> handleSend(session, codec.bind(node, SendRequest.class));
            case FrameTypes.WHO_ONLINE -> {
                reply(session, new PresenceFrame(registry.snapshotOnlineUsernames()));
                yield "ok";
            }
            case FrameTypes.ADMIN_CREATE_USER ->
                    handleAdminCreateUser(session, codec.bind(node, AdminCreateUserRequest.class));
            case FrameTypes.JOIN, FrameTypes.HISTORY_ROOM -> {
                reply(session, new ErrorFrame(ROOMS_DISABLED));
                yield "rooms_disabled";
            }
            default -> {
                reply(session, new ErrorFrame("Unknown type: " + (typed ? type : "null")));
                yield "unknown_type";
            }
        };
    }

    private String handleLogin(ChatSession session, LoginRequest request) {
        if (session.isAuthenticated()) {
            reply(session, new LoginErrorFrame(ALREADY_LOGGED_IN));
            return "already_authenticated";
        }
        Optional<Usuario> autenticado = store.authenticate(request.getUsername(), request.getPassword());
        if (autenticado.isEmpty()) {
            ServerMetrics.recordLoginFailure();
            LOGGER.log(Level.INFO, "Login fallido en {0}", session.getId());
            reply(session, new LoginErrorFrame(INVALID_CREDENTIALS));
            return "login_error";
        }
        Usuario usuario = autenticado.get();
        // historial, login_ok y la presencia del login se encolan sin que otro hilo difunda en medio
        String resultado = registry.withLock(() -> completeLogin(session, usuario));
        if ("ok".equals(resultado)) {
            ServerMetrics.recordLoginSuccess();
        }
        return resultado;
    }

    private String completeLogin(ChatSession session, Usuario usuario) {
        List<MessageDto> historial = store.fetchHistory(historyLimit).stream()
                .map(codec::toDto)
                .collect(Collectors.toList());
        reply(session, new LoginOkFrame(usuario.getUsername(), usuario.isAdmin()));
        reply(session, new HistoryFrame(historial));
        ServerMetrics.observeHistorySize(historial.size());
        try {
            registry.authenticate(session, usuario.getId(), usuario.getUsername(), usuario.isAdmin());
        } catch (AlreadyAuthenticatedException e) {
            reply(session, new LoginErrorFrame(ALREADY_LOGGED_IN));
            return "already_authenticated";
        }
        return "ok";
    }

    private String handleSend(ChatSession session, SendRequest request) {
        SessionIdentity identity = session.getIdentity();
        Optional<TipoMensaje> tipo = TipoMensaje.fromWireName(request.getKind());
        if (tipo.isEmpty()) {
            reply(session, new ErrorFrame("Send failed: Unknown message kind: " + request.getKind()));
            return "send_failed";
        }
        // insertar y difundir bajo el lock: un login concurrente recibe el mensaje una sola vez
        return registry.withLock(() -> storeAndBroadcast(session, identity, tipo.get(), request));
    }

    private String storeAndBroadcast(ChatSession session, SessionIdentity identity, TipoMensaje tipo,
                                     SendRequest request) {
        Mensaje guardado;
        try {
            guardado = store.insertMessage(identity.userId(), request.getContent(), tipo,
                    request.getSticker(), request.getReplyTo());
        } catch (ValidationException e) {
            reply(session, new ErrorFrame("Send failed: " + e.getMessage()));
            return "send_failed";
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "No se pudo guardar el mensaje de " + identity.username(), e);
            reply(session, new ErrorFrame("Send failed: " + INTERNAL_ERROR));
            return "send_failed";
        }
        Mensaje mensaje = guardado.conUsername(identity.username());
        broadcastEngine.broadcast(new MessageFrame(codec.toDto(mensaje)));
        eventBus.publish(new SessionEvent(SessionEventType.MESSAGE_SENT, session.getId(), identity.userId(),
                mensaje.getId()));
        return "ok";
    }

    private String handleAdminCreateUser(ChatSession session, AdminCreateUserRequest request) {
        String username = request.getUsername() == null ? "" : request.getUsername().trim();
        try {
            store.createUser(username, request.getPassword() == null ? "" : request.getPassword(), request.isAdmin());
        } catch (ValidationException e) {
            reply(session, new AdminCreateUserErrorFrame(e.getMessage()));
            return "validation_error";
        }
        LOGGER.log(Level.INFO, "{0} creó el usuario {1}", new Object[]{session.getIdentity().username(), username});
        reply(session, new AdminCreateUserOkFrame(username));
        return "ok";
    }

    private ServerFrame forbidden(String type) {
        if (FrameTypes.ADMIN_CREATE_USER.equals(type)) {
            return new AdminCreateUserErrorFrame(ADMIN_ONLY);
        }
        return new ErrorFrame(ADMIN_ONLY);
    }

    private void reply(ChatSession session, ServerFrame frame) {
        ClientConnection connection = session.getConnection();
        if (!connection.offer(codec.encode(frame))) {
            registry.evict(connection);
        }
    }
}
