package com.cmdchat.client.connection;

import com.cmdchat.client.config.ClientProperties;
import com.cmdchat.error.TransportException;
import com.cmdchat.protocol.ChannelPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;

import java.net.URI;

/**
 * Opens channels with a Spring {@link WebSocketClient} on Reactor Netty. The call blocks
 * until the WebSocket handshake completes or the connect timeout passes.
 */
public class ReactorChannelConnector implements ChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(ReactorChannelConnector.class);

    private final WebSocketClient client;
    private final ClientProperties properties;

    public ReactorChannelConnector(WebSocketClient client, ClientProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public ChannelConnection connect(ChannelPath channel, String username, String room) {
        URI uri = uri(channel, username, room);
        ReactorChannelConnection connection = new ReactorChannelConnection(channel);
        Disposable subscription = client.execute(uri, connection::bind)
                .subscribe(done -> { }, connection::failed, connection::completed);
        connection.attach(subscription);
        try {
            connection.awaitOpen(properties.connectTimeout());
        } catch (RuntimeException e) {
            connection.close();
            throw new TransportException("Cannot open " + channel.path() + " on "
                    + properties.serverLabel() + ": " + e.getMessage(), e);
        }
        log.debug("Opened {} for {} in room {}", channel.path(), username, room);
        return connection;
    }

    URI uri(ChannelPath channel, String username, String room) {
        return UriComponentsBuilder.fromUriString(properties.webSocketBaseUrl())
                .path(channel.path())
                .queryParam("password", properties.password() == null ? "" : properties.password())
                .queryParam("username", username)
                .queryParam("room_id", room)
                .encode()
                .build()
                .toUri();
    }
}
