package com.salachat.dto;

import java.util.List;

/**
 * Historial reciente de la sala, del más antiguo al más nuevo.
 */
public class HistoryFrame extends ServerFrame {

    private final List<MessageDto> messages;

    public HistoryFrame(List<MessageDto> messages) {
        super(FrameTypes.HISTORY);
        this.messages = List.copyOf(messages);
    }

    public List<MessageDto> getMessages() {
        return messages;
    }
}
