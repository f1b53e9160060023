package com.hidego.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Authenticated encryption of short strings with ChaCha20-Poly1305.
 * <p>
 * Envelope: {@code base64(salt[32] || nonce[12] || ciphertext+tag)}. The key for each
 * envelope is PBKDF2-HMAC-SHA256 (100 000 iterations) over the master passphrase and
 * the envelope's salt.
 * <p>
 * Randomized mode draws a fresh salt and nonce per call. Deterministic mode uses a salt
 * derived from the passphrase and a synthetic nonce keyed by the passphrase over the
 * plaintext, so equal inputs give equal envelopes across restarts and are usable as
 * lookup keys. Decryption never returns partial output: any tag or format mismatch
 * raises {@link EncryptionException}.
 */
public class Encryptor {

    static final int SALT_LENGTH = 32;
    static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH = 16;
    private static final String CIPHER = "ChaCha20-Poly1305";
    private static final String KEY_ALGORITHM = "ChaCha20";

    private final char[] passphrase;
    private final SecureRandom random = new SecureRandom();
    private final byte[] deterministicSalt;
    private final byte[] nonceKey;
    private final SecretKeySpec deterministicKey;

    public Encryptor(MasterPassphrase masterPassphrase) {
        this.passphrase = masterPassphrase.chars();
        byte[] passphraseBytes = KeyDerivation.passphraseBytes(passphrase);
        this.deterministicSalt = KeyDerivation.hmacSha256(passphraseBytes, "hidego/deterministic-salt");
        this.nonceKey = KeyDerivation.hmacSha256(passphraseBytes, "hidego/deterministic-nonce");
        this.deterministicKey = new SecretKeySpec(
                KeyDerivation.pbkdf2(passphrase, deterministicSalt), KEY_ALGORITHM);
        Arrays.fill(passphraseBytes, (byte) 0);
    }

    public String encrypt(String plaintext) {
        byte[] salt = new byte[SALT_LENGTH];
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(salt);
        random.nextBytes(nonce);
        SecretKeySpec key = new SecretKeySpec(KeyDerivation.pbkdf2(passphrase, salt), KEY_ALGORITHM);
        return seal(plaintext, salt, nonce, key);
    }

    public String encryptDeterministic(String plaintext) {
        byte[] nonce = Arrays.copyOf(KeyDerivation.hmacSha256(nonceKey, plaintext), NONCE_LENGTH);
        return seal(plaintext, deterministicSalt, nonce, deterministicKey);
    }

    public String decrypt(String encoded) {
        if (encoded == null) {
            throw new EncryptionException("Nothing to decrypt");
        }
        byte[] envelope;
        try {
            envelope = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Envelope is not valid base64", e);
        }
        if (envelope.length < SALT_LENGTH + NONCE_LENGTH + TAG_LENGTH) {
            throw new EncryptionException("Envelope too short");
        }

        byte[] salt = Arrays.copyOfRange(envelope, 0, SALT_LENGTH);
        byte[] nonce = Arrays.copyOfRange(envelope, SALT_LENGTH, SALT_LENGTH + NONCE_LENGTH);
        SecretKeySpec key = Arrays.equals(salt, deterministicSalt)
                ? deterministicKey
                : new SecretKeySpec(KeyDerivation.pbkdf2(passphrase, salt), KEY_ALGORITHM);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(nonce));
            byte[] plain = cipher.doFinal(envelope, SALT_LENGTH + NONCE_LENGTH,
                    envelope.length - SALT_LENGTH - NONCE_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Decryption failed", e);
        }
    }

    private String seal(String plaintext, byte[] salt, byte[] nonce, SecretKeySpec key) {
        try {
            // ChaCha20-Poly1305 ciphers refuse key/nonce reuse, so each call gets its own instance
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(nonce));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer envelope = ByteBuffer.allocate(salt.length + nonce.length + sealed.length);
            envelope.put(salt).put(nonce).put(sealed);
            return Base64.getEncoder().encodeToString(envelope.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed", e);
        }
    }
}
