package com.cmdchat.channel;

import com.cmdchat.error.TransportException;
import com.cmdchat.registry.ChatSocket;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Outbound side of one WebSocket session. Frames are queued in a bounded buffer that
 * the session's send pipeline drains; emitting never waits for delivery.
 */
public class SessionSocket implements ChatSocket {

    private final String id;
    private final Sinks.Many<String> outbound;
    private volatile boolean open = true;

    public SessionSocket(String id, int bufferSize) {
        this.id = id;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized void send(String payload) {
        if (!open) {
            throw new TransportException("Socket " + id + " is closed");
        }
        Sinks.EmitResult result = outbound.tryEmitNext(payload);
        if (result.isFailure()) {
            open = false;
            throw new TransportException("Socket " + id + " rejected frame: " + result);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /** Idempotent. */
    @Override
    public synchronized void close() {
        open = false;
        outbound.tryEmitComplete();
    }

    public Flux<String> frames() {
        return outbound.asFlux();
    }
}
