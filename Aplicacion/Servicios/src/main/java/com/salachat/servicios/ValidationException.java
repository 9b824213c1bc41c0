package com.salachat.servicios;

/**
 * Error de validación cuyo mensaje se devuelve tal cual al cliente.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
