package com.cmdchat.message;

import com.cmdchat.protocol.FieldRules;
import com.cmdchat.protocol.MessagePayload;
import com.cmdchat.protocol.MessageType;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored chat message. For text messages {@code content} is the sender's encrypted
 * token; the server never decrypts it.
 */
public record ChatMessage(
        String id,
        String roomId,
        String userId,
        String username,
        String content,
        MessageType type,
        Instant timestamp,
        boolean encrypted,
        String replyTo,
        String fileUrl
) {

    public static final String SYSTEM_USER_ID = "system";
    public static final String SYSTEM_USERNAME = "System";

    public ChatMessage {
        content = FieldRules.content(content);
        type = type == null ? MessageType.TEXT : type;
    }

    public static ChatMessage text(String roomId, String userId, String username, String content, Instant now) {
        return new ChatMessage(UUID.randomUUID().toString(), roomId, userId, username, content,
                MessageType.TEXT, now, true, null, null);
    }

    public static ChatMessage system(String roomId, String content, Instant now) {
        return new ChatMessage(UUID.randomUUID().toString(), roomId, SYSTEM_USER_ID, SYSTEM_USERNAME, content,
                MessageType.SYSTEM, now, false, null, null);
    }

    public MessagePayload toPayload() {
        return new MessagePayload(id, roomId, userId, username, content, type, timestamp.toString(),
                encrypted, replyTo, fileUrl);
    }
}
