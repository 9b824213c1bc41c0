package com.salachat.servicios.eventos;

import com.salachat.servicios.conexion.SessionDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionEventBusTest {

    @Test
    void entregaEnOrdenDeSuscripcionAunqueUnObserverFalle() {
        SessionEventBus bus = new SessionEventBus();
        List<String> recibidos = new ArrayList<>();
        bus.subscribe(event -> recibidos.add("primero:" + event.getType()));
        bus.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(event -> recibidos.add("tercero:" + event.getType()));

        bus.publish(new SessionEvent(SessionEventType.LOGIN, "s1", 1L, null));

        assertEquals(List.of("primero:LOGIN", "tercero:LOGIN"), recibidos);
    }

    @Test
    void unsubscribeDejaDeNotificar() {
        SessionEventBus bus = new SessionEventBus();
        List<SessionEvent> recibidos = new ArrayList<>();
        SessionObserver observer = recibidos::add;
        bus.subscribe(observer);
        bus.unsubscribe(observer);

        bus.publish(new SessionEvent(SessionEventType.TCP_CONNECTED, "s1", null, null));

        assertTrue(recibidos.isEmpty());
    }

    @Test
    void logSubscriberDescribeEventosConDescriptor() {
        SessionEventBus bus = new SessionEventBus();
        LogSubscriber subscriber = new LogSubscriber(bus);
        SessionDescriptor descriptor = new SessionDescriptor("s9", 4L, "alice", false, "10.0.0.1");

        String login = subscriber.describir(new SessionEvent(SessionEventType.LOGIN, "s9", 4L, descriptor));
        String conexion = subscriber.describir(new SessionEvent(SessionEventType.TCP_CONNECTED, "s9", null, descriptor));
        String anonimo = subscriber.describir(new SessionEvent(SessionEventType.TCP_DISCONNECTED, "s9", null, null));

        assertTrue(login.contains("alice"));
        assertTrue(conexion.contains("10.0.0.1"));
        assertTrue(anonimo.contains("anónimo"));
    }
}
