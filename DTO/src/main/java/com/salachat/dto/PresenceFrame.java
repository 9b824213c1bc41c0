package com.salachat.dto;

import java.util.List;

public class PresenceFrame extends ServerFrame {

    private final List<String> online;

    public PresenceFrame(List<String> online) {
        super(FrameTypes.PRESENCE);
        this.online = List.copyOf(online);
    }

    public List<String> getOnline() {
        return online;
    }
}
