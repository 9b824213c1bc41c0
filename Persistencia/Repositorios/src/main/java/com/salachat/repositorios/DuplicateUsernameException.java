package com.salachat.repositorios;

/**
 * Se lanza cuando la restricción de unicidad del nombre de usuario rechaza una inserción.
 */
public class DuplicateUsernameException extends RuntimeException {

    public DuplicateUsernameException(String username, Throwable cause) {
        super("Username already exists: " + username, cause);
    }
}
