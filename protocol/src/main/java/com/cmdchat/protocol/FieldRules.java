package com.cmdchat.protocol;

import com.cmdchat.error.ValidationException;

import java.util.regex.Pattern;

/** Field limits both ends enforce, so a client can reject input before it ever reaches the socket. */
public final class FieldRules {

    public static final int MIN_USERNAME_LENGTH = 2;
    public static final int MAX_USERNAME_LENGTH = 20;
    public static final int MAX_ROOM_NAME_LENGTH = 30;
    public static final int MAX_CONTENT_LENGTH = 1000;

    private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9_-]+");

    private FieldRules() {
    }

    /** @return the trimmed username */
    public static String username(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.length() < MIN_USERNAME_LENGTH) {
            throw new ValidationException("Username must be at least " + MIN_USERNAME_LENGTH + " characters");
        }
        if (value.length() > MAX_USERNAME_LENGTH) {
            throw new ValidationException("Username too long");
        }
        if (!USERNAME.matcher(value).matches()) {
            throw new ValidationException("Username can only contain letters, numbers, underscores, and hyphens");
        }
        return value;
    }

    /** @return the trimmed room name */
    public static String roomName(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            throw new ValidationException("room name is required");
        }
        if (value.length() > MAX_ROOM_NAME_LENGTH) {
            throw new ValidationException("room name too long");
        }
        return value;
    }

    /** @return the trimmed message content */
    public static String content(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            throw new ValidationException("Message cannot be empty");
        }
        if (value.length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("Message too long");
        }
        return value;
    }
}
