package com.salachat.dto;

public class LoginErrorFrame extends ServerFrame {

    private final String message;

    public LoginErrorFrame(String message) {
        super(FrameTypes.LOGIN_ERROR);
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
