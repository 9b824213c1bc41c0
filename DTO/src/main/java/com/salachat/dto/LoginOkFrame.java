package com.salachat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class LoginOkFrame extends ServerFrame {

    private final String username;
    private final boolean admin;

    public LoginOkFrame(String username, boolean admin) {
        super(FrameTypes.LOGIN_OK);
        this.username = username;
        this.admin = admin;
    }

    public String getUsername() {
        return username;
    }

    @JsonProperty("is_admin")
    public boolean isAdmin() {
        return admin;
    }
}
