package com.salachat.servicios.eventos;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publica eventos de sesión de forma síncrona, en el hilo que los emite y en orden de suscripción.
 */
public class SessionEventBus {

    private static final Logger LOGGER = Logger.getLogger(SessionEventBus.class.getName());

    private final List<SessionObserver> observers = new CopyOnWriteArrayList<>();

    public void subscribe(SessionObserver observer) {
        observers.add(observer);
    }

    public void unsubscribe(SessionObserver observer) {
        observers.remove(observer);
    }

    public void publish(SessionEvent event) {
        for (SessionObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Observer " + observer.getClass().getSimpleName()
                        + " fallo procesando " + event.getType(), e);
            }
        }
    }
}
