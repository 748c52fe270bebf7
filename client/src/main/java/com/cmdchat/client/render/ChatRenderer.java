package com.cmdchat.client.render;

import java.time.Instant;

/**
 * Everything the client shows the user goes through here, so the connection logic can
 * be driven without a terminal.
 */
public interface ChatRenderer {

    /**
     * @param timestamp server time of the message, or {@code null} when unknown
     * @param own       sent by the local user
     * @param system    a server announcement rather than a user message
     */
    void renderMessage(String username, String content, Instant timestamp, boolean own, boolean system);

    void info(String text);

    void warning(String text);

    void error(String text);

    /** Connection state changes, e.g. "connecting" or "connected". */
    void status(String text);

    void clear();
}
