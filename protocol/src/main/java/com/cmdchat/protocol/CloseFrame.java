package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CloseFrame(@JsonProperty("action") String action) {

    public static final String CLOSE = "close";

    public static CloseFrame close() {
        return new CloseFrame(CLOSE);
    }
}
