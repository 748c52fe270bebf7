package com.cmdchat.channel;

/**
 * Talk: CONNECTING → AUTHENTICATED → STREAMING → CLOSED.
 * Update: CONNECTING → AUTHENTICATED → SUBSCRIBED → CLOSED.
 * Any state may move straight to CLOSED.
 */
public enum ChannelState {
    CONNECTING,
    AUTHENTICATED,
    STREAMING,
    SUBSCRIBED,
    CLOSED;

    public boolean canMoveTo(ChannelState next) {
        if (next == CLOSED) {
            return this != CLOSED;
        }
        if (this == CONNECTING) {
            return next == AUTHENTICATED;
        }
        return this == AUTHENTICATED && (next == STREAMING || next == SUBSCRIBED);
    }
}
