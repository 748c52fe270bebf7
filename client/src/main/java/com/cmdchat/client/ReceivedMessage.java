package com.cmdchat.client;

import java.time.Instant;

/** A message as shown to the user, content already decrypted. */
public record ReceivedMessage(
        String id,
        String username,
        String content,
        Instant timestamp,
        boolean system
) {}
