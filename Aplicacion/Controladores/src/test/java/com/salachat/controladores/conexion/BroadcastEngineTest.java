package com.salachat.controladores.conexion;

import com.fasterxml.jackson.databind.JsonNode;
import com.salachat.dto.ErrorFrame;
import com.salachat.servicios.eventos.SessionEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BroadcastEngineTest {

    private ConnectionRegistry registry;
    private BroadcastEngine broadcastEngine;

    @BeforeEach
    void setUp() {
        SessionEventBus eventBus = new SessionEventBus();
        registry = new ConnectionRegistry(eventBus);
        broadcastEngine = new BroadcastEngine(registry, new FrameCodec());
        new PresenceTracker(registry, broadcastEngine, eventBus);
    }

    @Test
    void entregaElMismoFrameATodasLasConexiones() {
        RecordingConnection a = new RecordingConnection();
        RecordingConnection b = new RecordingConnection();
        RecordingConnection anonimo = new RecordingConnection();
        registry.authenticate(registry.register(a), 1L, "alice", false);
        registry.authenticate(registry.register(b), 2L, "bob", false);
        registry.register(anonimo);
        a.clear();
        b.clear();

        int entregados = broadcastEngine.broadcast(new ErrorFrame("aviso"));

        assertEquals(3, entregados);
        assertEquals(a.rawFrames(), b.rawFrames());
        assertEquals(a.rawFrames(), anonimo.rawFrames());
        assertEquals("aviso", anonimo.last().get("message").asText());
    }

    @Test
    void conexionMuertaSeExpulsaYLosDemasRecibenPresencia() {
        RecordingConnection a = new RecordingConnection();
        RecordingConnection b = new RecordingConnection();
        RecordingConnection lenta = new RecordingConnection();
        registry.authenticate(registry.register(a), 1L, "alice", false);
        registry.authenticate(registry.register(b), 2L, "bob", false);
        registry.authenticate(registry.register(lenta), 3L, "carol", false);
        a.clear();
        b.clear();
        lenta.rejectFrames();

        int entregados = broadcastEngine.broadcast(new ErrorFrame("hola"));

        assertEquals(2, entregados);
        assertFalse(lenta.isOpen());
        assertEquals(2, registry.size());
        for (RecordingConnection viva : List.of(a, b)) {
            assertEquals(List.of("error", "presence"), viva.types());
            JsonNode presencia = viva.last();
            assertEquals(2, presencia.get("online").size());
            assertEquals("alice", presencia.get("online").get(0).asText());
            assertEquals("bob", presencia.get("online").get(1).asText());
        }
    }

    @Test
    void desconexionAnonimaNoDifundePresencia() {
        RecordingConnection a = new RecordingConnection();
        RecordingConnection anonimo = new RecordingConnection();
        registry.authenticate(registry.register(a), 1L, "alice", false);
        ChatSession sesionAnonima = registry.register(anonimo);
        a.clear();

        registry.unregister(sesionAnonima);

        assertTrue(a.received().isEmpty());
    }

    @Test
    void presenciaSeDifundeEnOrdenDeMutacion() {
        RecordingConnection observador = new RecordingConnection();
        registry.register(observador);
        ChatSession alice = registry.register(new RecordingConnection());
        ChatSession bob = registry.register(new RecordingConnection());

        registry.authenticate(alice, 1L, "alice", false);
        registry.authenticate(bob, 2L, "bob", false);
        registry.unregister(alice);

        List<JsonNode> frames = observador.received();
        assertEquals(3, frames.size());
        assertEquals("[\"alice\"]", frames.get(0).get("online").toString());
        assertEquals("[\"alice\",\"bob\"]", frames.get(1).get("online").toString());
        assertEquals("[\"bob\"]", frames.get(2).get("online").toString());
    }
}
