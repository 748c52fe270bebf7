package com.cmdchat.client.connection;

import com.cmdchat.error.TransportException;
import com.cmdchat.protocol.ChannelPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bridges a reactive WebSocket session to blocking callers: outbound frames go through
 * a unicast sink, inbound frames are queued until polled. The inbound queue is bounded;
 * when the reader falls behind, the oldest frames are dropped.
 */
class ReactorChannelConnection implements ChannelConnection {

    private static final Logger log = LoggerFactory.getLogger(ReactorChannelConnection.class);

    private static final Duration CLOSE_STATUS_WAIT = Duration.ofSeconds(1);

    static final int INBOUND_CAPACITY = 1_000;

    private final ChannelPath channel;
    private final Sinks.One<Void> opened = Sinks.one();
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>(INBOUND_CAPACITY);
    private volatile boolean open;
    private volatile Integer closeCode;
    private volatile Disposable subscription;

    ReactorChannelConnection(ChannelPath channel) {
        this.channel = channel;
    }

    Mono<Void> bind(WebSocketSession session) {
        open = true;
        opened.tryEmitEmpty();

        // the close code must be recorded before the channel reports itself closed
        Mono<Void> closeStatus = session.closeStatus()
                .doOnNext(status -> closeCode = status.getCode())
                .then()
                .timeout(CLOSE_STATUS_WAIT, Mono.empty());
        Mono<Void> receive = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(this::enqueue)
                .then(closeStatus)
                .doFinally(signal -> markClosed());
        Mono<Void> send = session.send(outbound.asFlux().map(session::textMessage));

        return Mono.when(receive, send);
    }

    private void enqueue(String frame) {
        while (!inbound.offer(frame)) {
            String dropped = inbound.poll();
            if (dropped != null) {
                log.debug("{} inbound queue full, dropped oldest frame", channel.path());
            }
        }
    }

    void attach(Disposable subscription) {
        this.subscription = subscription;
    }

    void awaitOpen(Duration timeout) {
        opened.asMono().block(timeout);
    }

    void failed(Throwable error) {
        log.debug("{} failed: {}", channel.path(), error.getMessage());
        opened.tryEmitError(error);
        markClosed();
    }

    void completed() {
        markClosed();
    }

    private void markClosed() {
        open = false;
        outbound.tryEmitComplete();
    }

    @Override
    public synchronized void send(String frame) {
        if (!open) {
            throw new TransportException(channel.path() + " channel is closed");
        }
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isFailure()) {
            throw new TransportException(channel.path() + " channel rejected frame: " + result);
        }
    }

    @Override
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public List<String> drain() {
        List<String> frames = new ArrayList<>();
        inbound.drainTo(frames);
        return frames;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public OptionalInt closeCode() {
        Integer code = closeCode;
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    @Override
    public void close() {
        markClosed();
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
    }
}
