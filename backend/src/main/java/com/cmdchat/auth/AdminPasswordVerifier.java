package com.cmdchat.auth;

import com.cmdchat.config.ChatProperties;
import com.cmdchat.error.AuthException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Single shared admin password. When none is configured every check passes.
 */
@Component
public class AdminPasswordVerifier {

    private final byte[] expected;

    public AdminPasswordVerifier(ChatProperties properties) {
        String password = properties.adminPassword();
        this.expected = password == null || password.isEmpty()
                ? null
                : password.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isEnabled() {
        return expected != null;
    }

    public boolean matches(String supplied) {
        if (expected == null) {
            return true;
        }
        if (supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, supplied.getBytes(StandardCharsets.UTF_8));
    }

    public void verify(String supplied) {
        if (!matches(supplied)) {
            throw new AuthException();
        }
    }
}
