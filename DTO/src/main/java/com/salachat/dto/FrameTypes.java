package com.salachat.dto;

/**
 * Valores del discriminador {@code type} de cada frame del protocolo.
 */
public final class FrameTypes {

    // cliente -> servidor
    public static final String LOGIN = "login";
    public static final String SEND = "send";
    public static final String WHO_ONLINE = "who_online";
    public static final String ADMIN_CREATE_USER = "admin_create_user";
    public static final String JOIN = "join";
    public static final String HISTORY_ROOM = "history_room";

    // servidor -> cliente
    public static final String LOGIN_OK = "login_ok";
    public static final String LOGIN_ERROR = "login_error";
    public static final String HISTORY = "history";
    public static final String MESSAGE = "message";
    public static final String PRESENCE = "presence";
    public static final String ADMIN_CREATE_USER_OK = "admin_create_user_ok";
    public static final String ADMIN_CREATE_USER_ERROR = "admin_create_user_error";
    public static final String ERROR = "error";

    private FrameTypes() {
    }
}
