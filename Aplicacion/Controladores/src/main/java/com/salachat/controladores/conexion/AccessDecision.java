package com.salachat.controladores.conexion;

public enum AccessDecision {
    UNAUTHENTICATED,
    AUTHORIZED,
    FORBIDDEN
}
