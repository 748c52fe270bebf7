package com.cmdchat.room;

import com.cmdchat.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RoomType {
    PUBLIC,
    PRIVATE,
    DIRECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Absent means public. */
    public static RoomType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return PUBLIC;
        }
        try {
            return RoomType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown room type: " + value);
        }
    }
}
