package com.cmdchat.protocol;

/** Application close codes (RFC 6455 reserves 4000-4999 for private use). */
public final class CloseCodes {

    public static final int INVALID_PARAMETERS = 4000;
    public static final int UNAUTHORIZED = 4001;
    public static final int UNKNOWN_ROOM = 4004;

    private CloseCodes() {
    }
}
