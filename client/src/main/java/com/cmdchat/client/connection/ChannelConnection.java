package com.cmdchat.client.connection;

import com.cmdchat.error.TransportException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/** One open WebSocket channel, used from plain threads. */
public interface ChannelConnection extends AutoCloseable {

    /** @throws TransportException if the channel is closed or cannot queue the frame */
    void send(String frame);

    /** Waits up to {@code timeout} for the next inbound frame. */
    Optional<String> poll(Duration timeout) throws InterruptedException;

    /** Every inbound frame already received, without waiting. */
    List<String> drain();

    boolean isOpen();

    /** The close code sent by the server, once the channel has closed. */
    OptionalInt closeCode();

    /** Idempotent and never throws. */
    @Override
    void close();
}
