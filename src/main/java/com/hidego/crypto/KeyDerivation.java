package com.hidego.crypto;

import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * PBKDF2 and HMAC helpers shared by the encryptor, the passphrase verification
 * record and the anonymous id generator.
 */
final class KeyDerivation {

    static final int ITERATIONS = 100_000;
    static final int KEY_LENGTH_BYTES = 32;

    private KeyDerivation() {}

    static byte[] pbkdf2(char[] passphrase, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(passphrase, salt, ITERATIONS, KEY_LENGTH_BYTES * 8);
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }

    static byte[] hmacSha256(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("HMAC computation failed", e);
        }
    }

    static byte[] hmacSha256(byte[] key, String data) {
        return hmacSha256(key, data.getBytes(StandardCharsets.UTF_8));
    }

    static byte[] passphraseBytes(char[] passphrase) {
        return new String(passphrase).getBytes(StandardCharsets.UTF_8);
    }
}
