package com.salachat.dto;

public class AdminCreateUserOkFrame extends ServerFrame {

    private final String username;

    public AdminCreateUserOkFrame(String username) {
        super(FrameTypes.ADMIN_CREATE_USER_OK);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
