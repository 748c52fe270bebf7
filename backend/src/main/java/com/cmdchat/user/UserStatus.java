package com.cmdchat.user;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UserStatus {
    ONLINE,
    AWAY,
    OFFLINE,
    BUSY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
