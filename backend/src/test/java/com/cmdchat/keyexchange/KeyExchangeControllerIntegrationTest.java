package com.cmdchat.keyexchange;

import com.cmdchat.crypto.KeyExchangeCipher;
import com.cmdchat.crypto.TokenCipher;
import com.cmdchat.registry.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP-layer integration tests for {@code /get_key}.
 *
 * Uses @SpringBootTest(webEnvironment = RANDOM_PORT) + WebTestClient against the real
 * registry; the test profile sets the admin password to {@code s3cret}.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class KeyExchangeControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private RoomRegistry registry;

    private KeyPair keyPair;
    private String pem;

    @BeforeEach
    void setup() {
        keyPair = KeyExchangeCipher.generateKeyPair();
        pem = KeyExchangeCipher.encodePublicKey(keyPair.getPublic());
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private MultipartBodyBuilder multipart(String password) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("pubkey", new ByteArrayResource(pem.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "public_key.pem";
            }
        });
        builder.part("username", "alice");
        builder.part("password", password);
        return builder;
    }

    private void assertUnwrapsToServerKey(byte[] body) {
        assertNotNull(body);
        byte[] unwrapped = KeyExchangeCipher.unwrap(body, keyPair.getPrivate());
        assertArrayEquals(registry.symmetricKey(), unwrapped);

        TokenCipher clientSide = new TokenCipher(unwrapped, Duration.ZERO);
        TokenCipher serverSide = new TokenCipher(registry.symmetricKey(), Duration.ZERO);
        assertEquals("hello", serverSide.decrypt(clientSide.encrypt("hello")));
    }

    // ── POST /get_key ─────────────────────────────────────────────────────────

    @Test
    void multipartUpload_correctPassword_returnsWrappedKey() {
        byte[] body = webTestClient.post()
                .uri("/get_key")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("s3cret").build()))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.APPLICATION_OCTET_STREAM)
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        assertUnwrapsToServerKey(body);
        assertTrue(registry.userCount() >= 1, "Key exchange must record the user");
    }

    @Test
    void jsonBody_correctPassword_returnsWrappedKey() {
        byte[] body = webTestClient.post()
                .uri("/get_key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("pubkey", pem, "username", "bob", "password", "s3cret"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        assertUnwrapsToServerKey(body);
    }

    @Test
    void queryArguments_correctPassword_returnsWrappedKey() {
        byte[] body = webTestClient.get()
                .uri(builder -> builder.path("/get_key")
                        .queryParam("pubkey", "{pem}")
                        .queryParam("username", "carol")
                        .queryParam("password", "s3cret")
                        .build(pem))
                .exchange()
                .expectStatus().isOk()
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        assertUnwrapsToServerKey(body);
    }

    @Test
    void wrongPassword_returns401WithNoKeyMaterial() {
        webTestClient.post()
                .uri("/get_key")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("wrong").build()))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("unauthorized");
    }

    @Test
    void missingPublicKey_returns400() {
        webTestClient.post()
                .uri("/get_key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("username", "alice", "password", "s3cret"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("public key is required");
    }

    @Test
    void garbagePublicKey_returns400() {
        webTestClient.post()
                .uri("/get_key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("pubkey", "-----BEGIN PUBLIC KEY-----\nnope\n-----END PUBLIC KEY-----",
                        "password", "s3cret"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid public key");
    }
}
