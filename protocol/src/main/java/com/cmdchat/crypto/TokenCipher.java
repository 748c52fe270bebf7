package com.cmdchat.crypto;

import com.cmdchat.error.CryptoException;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;

/**
 * Self-expiring authenticated token for chat payloads.
 *
 * <pre>
 *   token = base64url( version(1) | issuedAtSeconds(8) | iv(12) | AES-256-GCM(ciphertext + tag) )
 * </pre>
 *
 * The version byte and the timestamp are authenticated as AAD, so a token cannot be
 * re-dated without breaking the tag. Tokens older than {@code maxAge} are rejected;
 * a zero or negative {@code maxAge} disables the age check.
 */
public final class TokenCipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final int KEY_SIZE = 32;

    private static final byte VERSION = (byte) 0x81;
    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final int HEADER_SIZE = 1 + Long.BYTES;
    private static final int IV_SIZE = 12;
    private static final int TAG_SIZE = 128;
    private static final Duration MAX_CLOCK_SKEW = Duration.ofSeconds(60);

    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] key;
    private final Duration maxAge;
    private final Clock clock;
    private volatile boolean destroyed;

    public TokenCipher(byte[] key, Duration maxAge) {
        this(key, maxAge, Clock.systemUTC());
    }

    public TokenCipher(byte[] key, Duration maxAge, Clock clock) {
        if (key == null || key.length != KEY_SIZE) {
            throw new CryptoException("Symmetric key must be " + KEY_SIZE + " bytes");
        }
        this.key = key.clone();
        this.maxAge = maxAge == null ? Duration.ZERO : maxAge;
        this.clock = clock;
    }

    public static byte[] generateKey() {
        byte[] key = new byte[KEY_SIZE];
        RANDOM.nextBytes(key);
        return key;
    }

    public String encrypt(String plaintext) {
        ensureUsable();
        byte[] header = header(clock.instant().getEpochSecond());
        byte[] iv = new byte[IV_SIZE];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            cipher.updateAAD(header);
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer token = ByteBuffer.allocate(HEADER_SIZE + IV_SIZE + ciphertext.length);
            token.put(header).put(iv).put(ciphertext);
            return Base64.getUrlEncoder().encodeToString(token.array());
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Encryption failed", e);
        }
    }

    public String decrypt(String token) {
        ensureUsable();
        if (token == null || token.isEmpty()) {
            throw new CryptoException("Missing token");
        }
        byte[] decoded;
        try {
            decoded = Base64.getUrlDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Malformed token", e);
        }
        if (decoded.length < HEADER_SIZE + IV_SIZE + TAG_SIZE / 8 || decoded[0] != VERSION) {
            throw new CryptoException("Malformed token");
        }

        long issuedAt = ByteBuffer.wrap(decoded, 1, Long.BYTES).getLong();
        checkAge(issuedAt);

        byte[] header = Arrays.copyOfRange(decoded, 0, HEADER_SIZE);
        byte[] iv = Arrays.copyOfRange(decoded, HEADER_SIZE, HEADER_SIZE + IV_SIZE);
        byte[] ciphertext = Arrays.copyOfRange(decoded, HEADER_SIZE + IV_SIZE, decoded.length);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            cipher.updateAAD(header);
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Decryption failed", e);
        }
    }

    /** Zeroes the key. Every later call fails with {@link CryptoException}. */
    public void destroy() {
        destroyed = true;
        Arrays.fill(key, (byte) 0);
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkAge(long issuedAtSeconds) {
        Instant now = clock.instant();
        Instant issuedAt = Instant.ofEpochSecond(issuedAtSeconds);
        if (issuedAt.isAfter(now.plus(MAX_CLOCK_SKEW))) {
            throw new CryptoException("Token timestamp is in the future");
        }
        if (!maxAge.isZero() && !maxAge.isNegative() && issuedAt.plus(maxAge).isBefore(now)) {
            throw new CryptoException("Token expired");
        }
    }

    private void ensureUsable() {
        if (destroyed) {
            throw new CryptoException("Symmetric key has been destroyed");
        }
    }

    private static byte[] header(long epochSeconds) {
        return ByteBuffer.allocate(HEADER_SIZE).put(VERSION).putLong(epochSeconds).array();
    }
}
