package com.salachat.servicios.eventos;

public enum SessionEventType {
    TCP_CONNECTED,
    LOGIN,
    TCP_DISCONNECTED,
    MESSAGE_SENT,
    CONNECTION_EVICTED
}
