package com.salachat.controladores.conexion;

/**
 * Identidad de una sesión autenticada. Se asigna completa, de una sola vez.
 */
public record SessionIdentity(long userId, String username, boolean admin) {
}
