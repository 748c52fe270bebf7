package com.cmdchat.channel;

import com.cmdchat.web.RequestArguments;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Query parameters a client supplies when opening a channel:
 * {@code ?password=...&username=...&room_id=...}.
 */
record ConnectionParameters(String password, String username, String roomRef, String address) {

    static final String UNKNOWN_USER = "unknown";

    static ConnectionParameters from(HandshakeInfo handshake, String defaultRoom) {
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(handshake.getUri())
                .build()
                .getQueryParams();
        String username = param(query, "username");
        String room = param(query, "room_id");
        return new ConnectionParameters(
                param(query, "password"),
                username == null ? UNKNOWN_USER : username,
                room == null ? defaultRoom : room,
                RequestArguments.hostOf(handshake.getRemoteAddress()));
    }

    private static String param(MultiValueMap<String, String> query, String name) {
        String raw = query.getFirst(name);
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return UriUtils.decode(raw, StandardCharsets.UTF_8);
    }
}
