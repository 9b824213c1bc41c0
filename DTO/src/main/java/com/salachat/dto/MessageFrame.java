package com.salachat.dto;

public class MessageFrame extends ServerFrame {

    private final MessageDto message;

    public MessageFrame(MessageDto message) {
        super(FrameTypes.MESSAGE);
        this.message = message;
    }

    public MessageDto getMessage() {
        return message;
    }
}
