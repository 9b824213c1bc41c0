package com.salachat.controladores.conexion;

import com.salachat.dto.FrameTypes;

import java.util.Set;

/**
 * Decide si una sesión puede ejecutar un tipo de frame antes de despacharlo.
 */
public class AccessPolicy {

    private static final Set<String> ADMIN_ONLY = Set.of(FrameTypes.ADMIN_CREATE_USER);

    public AccessDecision decide(String type, ChatSession session) {
        if (FrameTypes.LOGIN.equals(type)) {
            return AccessDecision.AUTHORIZED;
        }
        SessionIdentity identity = session.getIdentity();
        if (identity == null) {
            return AccessDecision.UNAUTHENTICATED;
        }
        if (ADMIN_ONLY.contains(type) && !identity.admin()) {
            return AccessDecision.FORBIDDEN;
        }
        return AccessDecision.AUTHORIZED;
    }
}
