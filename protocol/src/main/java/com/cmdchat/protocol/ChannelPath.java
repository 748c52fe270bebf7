package com.cmdchat.protocol;

/** The two WebSocket endpoints every client holds open against the same server. */
public enum ChannelPath {
    TALK("/talk"),
    UPDATE("/update");

    private final String path;

    ChannelPath(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
