package com.cmdchat.registry;

/**
 * The registry's view of a connected socket. {@link #send} only queues the frame; it
 * throws {@link com.cmdchat.error.TransportException} when the socket can no longer
 * accept frames (closed, cancelled, or its outbound buffer is full).
 */
public interface ChatSocket {

    String id();

    void send(String payload);

    boolean isOpen();

    /** Stops accepting frames and ends the outbound stream once queued frames are flushed. */
    void close();
}
