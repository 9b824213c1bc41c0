package com.salachat.dto;

public class AdminCreateUserErrorFrame extends ServerFrame {

    private final String message;

    public AdminCreateUserErrorFrame(String message) {
        super(FrameTypes.ADMIN_CREATE_USER_ERROR);
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
