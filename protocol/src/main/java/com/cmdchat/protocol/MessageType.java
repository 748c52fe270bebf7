package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageType {
    TEXT,
    SYSTEM,
    EMOJI,
    FILE,
    COMMAND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType fromWireName(String value) {
        return MessageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
