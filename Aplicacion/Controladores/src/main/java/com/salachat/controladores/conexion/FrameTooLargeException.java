package com.salachat.controladores.conexion;

import java.io.IOException;

/**
 * La línea recibida supera el tamaño máximo de frame. El resto de la línea ya fue descartado.
 */
public class FrameTooLargeException extends IOException {

    private final int limit;

    public FrameTooLargeException(int limit) {
        super("Frame supera el máximo de " + limit + " bytes");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
