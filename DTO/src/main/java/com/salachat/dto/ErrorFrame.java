package com.salachat.dto;

public class ErrorFrame extends ServerFrame {

    private final String message;

    public ErrorFrame(String message) {
        super(FrameTypes.ERROR);
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
