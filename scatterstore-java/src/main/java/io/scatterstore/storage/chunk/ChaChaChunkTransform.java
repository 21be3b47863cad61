package io.scatterstore.storage.chunk;

import io.scatterstore.storage.error.StorageException;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * ChaCha20-Poly1305 encryption of chunk bytes. Layout: 12-byte nonce followed by ciphertext and tag.
 */
public class ChaChaChunkTransform implements ChunkTransform {

    private static final int NONCE_SIZE = 12;
    private static final String CIPHER_ALGO = "ChaCha20-Poly1305";

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public ChaChaChunkTransform(byte[] key) {
        if (key.length != 32) {
            throw new IllegalArgumentException("ChaCha20 key must be 32 bytes");
        }
        this.key = new SecretKeySpec(key, "ChaCha20");
    }

    /**
     * Derive the chunk key from a configured passphrase.
     */
    public static ChaChaChunkTransform fromPassphrase(String passphrase) {
        try {
            Mac hmac = Mac.getInstance("HmacSHA256");
            hmac.init(new SecretKeySpec(passphrase.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            hmac.update("scatterstore:chunk-key".getBytes(StandardCharsets.UTF_8));
            return new ChaChaChunkTransform(hmac.doFinal());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    @Override
    public byte[] encode(byte[] plaintext) {
        try {
            byte[] nonce = new byte[NONCE_SIZE];
            random.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGO);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(nonce));
            byte[] ciphertext = cipher.doFinal(plaintext);

            ByteBuffer result = ByteBuffer.allocate(NONCE_SIZE + ciphertext.length);
            result.put(nonce);
            result.put(ciphertext);
            return result.array();
        } catch (GeneralSecurityException e) {
            throw new StorageException("Failed to encrypt chunk", e);
        }
    }

    @Override
    public byte[] decode(byte[] stored) {
        if (stored.length < NONCE_SIZE) {
            throw new StorageException("Encrypted chunk is truncated");
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(stored);
            byte[] nonce = new byte[NONCE_SIZE];
            buf.get(nonce);
            byte[] ciphertext = new byte[buf.remaining()];
            buf.get(ciphertext);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGO);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(nonce));
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new StorageException("Failed to decrypt chunk", e);
        }
    }
}
