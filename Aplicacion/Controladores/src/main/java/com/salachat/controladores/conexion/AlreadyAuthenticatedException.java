package com.salachat.controladores.conexion;

public class AlreadyAuthenticatedException extends IllegalStateException {

    public AlreadyAuthenticatedException(String sessionId) {
        super("La sesión " + sessionId + " ya está autenticada");
    }
}
