package com.cmdchat.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/** Tracks one connection through its {@link ChannelState}s. */
class ChannelLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ChannelLifecycle.class);

    private final String channel;
    private final String sessionId;
    private final AtomicReference<ChannelState> state = new AtomicReference<>(ChannelState.CONNECTING);

    ChannelLifecycle(String channel, String sessionId) {
        this.channel = channel;
        this.sessionId = sessionId;
    }

    void moveTo(ChannelState next) {
        ChannelState previous = state.get();
        if (!previous.canMoveTo(next) || !state.compareAndSet(previous, next)) {
            throw new IllegalStateException(channel + " session " + sessionId
                    + " cannot move from " + state.get() + " to " + next);
        }
        log.debug("{} session {}: {} -> {}", channel, sessionId, previous, next);
    }

    /** @return true only for the call that actually closed the channel */
    boolean close() {
        ChannelState previous = state.getAndSet(ChannelState.CLOSED);
        if (previous != ChannelState.CLOSED) {
            log.debug("{} session {}: {} -> CLOSED", channel, sessionId, previous);
            return true;
        }
        return false;
    }

    ChannelState current() {
        return state.get();
    }
}
