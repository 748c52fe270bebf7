package com.cmdchat.client.connection;

import com.cmdchat.error.TransportException;
import com.cmdchat.protocol.ChannelPath;

@FunctionalInterface
public interface ChannelConnector {

    /**
     * Opens {@code channel} for the given user and room.
     *
     * @throws TransportException if the handshake does not complete
     */
    ChannelConnection connect(ChannelPath channel, String username, String room);
}
