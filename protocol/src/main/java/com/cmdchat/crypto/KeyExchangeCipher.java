package com.cmdchat.crypto;

import com.cmdchat.error.CryptoException;
import com.cmdchat.error.ValidationException;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.RSAKeyGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * Asymmetric half of the hybrid handshake.
 *
 * The client publishes an RSA-2048 public key; the server wraps the process-wide
 * symmetric key with RSA-OAEP (SHA-256 digest, MGF1-SHA-256, empty label) so that
 * only the holder of the matching private key can recover it.
 */
public final class KeyExchangeCipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final String RSA_ALGO = "RSA/ECB/OAEPPadding";
    private static final int KEY_SIZE = 2048;
    private static final String PEM_TYPE = "PUBLIC KEY";

    private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    private KeyExchangeCipher() {
    }

    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA", BouncyCastleProvider.PROVIDER_NAME);
            generator.initialize(new RSAKeyGenParameterSpec(KEY_SIZE, RSAKeyGenParameterSpec.F4), new SecureRandom());
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Key generation failed", e);
        }
    }

    /** SubjectPublicKeyInfo, PEM armoured. */
    public static String encodePublicKey(PublicKey publicKey) {
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(new PemObject(PEM_TYPE, publicKey.getEncoded()));
        } catch (IOException e) {
            throw new CryptoException("Failed to export public key", e);
        }
        return out.toString();
    }

    public static PublicKey decodePublicKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new ValidationException("public key is required");
        }
        PemObject object;
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            object = reader.readPemObject();
        } catch (IOException e) {
            throw new ValidationException("invalid public key");
        }
        if (object == null || !PEM_TYPE.equals(object.getType())) {
            throw new ValidationException("invalid public key");
        }
        try {
            KeyFactory factory = KeyFactory.getInstance("RSA", BouncyCastleProvider.PROVIDER_NAME);
            return factory.generatePublic(new X509EncodedKeySpec(object.getContent()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ValidationException("invalid public key");
        }
    }

    public static byte[] wrap(byte[] secret, PublicKey recipient) {
        try {
            Cipher cipher = Cipher.getInstance(RSA_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, recipient, OAEP_SHA256, new SecureRandom());
            return cipher.doFinal(secret);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to wrap symmetric key", e);
        }
    }

    public static byte[] unwrap(byte[] wrapped, PrivateKey privateKey) {
        if (wrapped == null || wrapped.length == 0) {
            throw new CryptoException("Empty key exchange response");
        }
        try {
            Cipher cipher = Cipher.getInstance(RSA_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256);
            return cipher.doFinal(wrapped);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to unwrap symmetric key", e);
        }
    }
}
