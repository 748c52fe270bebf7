package com.cmdchat.client.support;

import com.cmdchat.client.connection.ChannelConnection;
import com.cmdchat.client.connection.ChannelConnector;
import com.cmdchat.error.TransportException;
import com.cmdchat.protocol.ChannelPath;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Hands out {@link FakeConnection}s and records every attempt. Talk connections
 * acknowledge each frame unless a different responder is set.
 */
public class FakeConnector implements ChannelConnector {

    public final List<FakeConnection> connections = new CopyOnWriteArrayList<>();

    private final Map<ChannelPath, AtomicInteger> attempts = new EnumMap<>(ChannelPath.class);
    private final Map<ChannelPath, AtomicInteger> failuresLeft = new EnumMap<>(ChannelPath.class);
    private volatile Function<String, List<String>> talkResponder =
            frame -> List.of("{\"status\":\"ok\",\"message_id\":\"m-" + System.nanoTime() + "\"}");
    private volatile Consumer<FakeConnection> onUpdateOpened = connection -> { };

    public FakeConnector() {
        for (ChannelPath path : ChannelPath.values()) {
            attempts.put(path, new AtomicInteger());
            failuresLeft.put(path, new AtomicInteger());
        }
    }

    public FakeConnector failNext(ChannelPath channel, int times) {
        failuresLeft.get(channel).set(times);
        return this;
    }

    public FakeConnector talkResponder(Function<String, List<String>> responder) {
        this.talkResponder = responder;
        return this;
    }

    public FakeConnector onUpdateOpened(Consumer<FakeConnection> hook) {
        this.onUpdateOpened = hook;
        return this;
    }

    public int attempts(ChannelPath channel) {
        return attempts.get(channel).get();
    }

    public List<FakeConnection> opened(ChannelPath channel) {
        return connections.stream().filter(connection -> connection.channel == channel).toList();
    }

    public Optional<FakeConnection> latest(ChannelPath channel) {
        List<FakeConnection> opened = opened(channel);
        return opened.isEmpty() ? Optional.empty() : Optional.of(opened.get(opened.size() - 1));
    }

    @Override
    public ChannelConnection connect(ChannelPath channel, String username, String room) {
        attempts.get(channel).incrementAndGet();
        if (failuresLeft.get(channel).getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
            throw new TransportException("Connection refused");
        }
        FakeConnection connection = new FakeConnection(channel, username, room,
                channel == ChannelPath.TALK ? talkResponder : frame -> List.of());
        connections.add(connection);
        if (channel == ChannelPath.UPDATE) {
            onUpdateOpened.accept(connection);
        }
        return connection;
    }
}
