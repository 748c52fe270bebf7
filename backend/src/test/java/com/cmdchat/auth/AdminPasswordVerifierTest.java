package com.cmdchat.auth;

import com.cmdchat.error.AuthException;
import com.cmdchat.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminPasswordVerifierTest {

    @Test
    void configuredPassword_mustMatchExactly() {
        AdminPasswordVerifier verifier = new AdminPasswordVerifier(TestFixtures.properties("s3cret"));

        assertTrue(verifier.isEnabled());
        assertTrue(verifier.matches("s3cret"));
        assertFalse(verifier.matches("S3cret"));
        assertFalse(verifier.matches(""));
        assertFalse(verifier.matches(null));
        assertThrows(AuthException.class, () -> verifier.verify("wrong"));
    }

    @Test
    void noPassword_acceptsEverything() {
        AdminPasswordVerifier verifier = new AdminPasswordVerifier(TestFixtures.properties(""));

        assertFalse(verifier.isEnabled());
        assertTrue(verifier.matches(null));
        assertDoesNotThrow(() -> verifier.verify("anything"));
    }
}
