package com.hidego.correlation;

import com.hidego.crypto.EncryptionException;
import com.hidego.crypto.Encryptor;
import org.springframework.stereotype.Component;

/**
 * Encrypts correlation records and divides the ciphertext so that neither the
 * database nor a button payload alone can reconstruct it.
 * <p>
 * {@code prefix} is the first 30 characters, {@code suffix} the last 30, and the
 * stored portion everything except the suffix. The envelope is always longer than
 * 30 characters; a shorter one is a programming error.
 */
@Component
public class Correlator {

    static final int SPLIT_LENGTH = 30;

    private final Encryptor encryptor;

    public Correlator(Encryptor encryptor) {
        this.encryptor = encryptor;
    }

    public SplitToken mint(AdminControlRecord record) {
        return split(encryptor.encrypt(record.toPlaintext()));
    }

    public SplitToken mint(ReadReceiptRecord record) {
        return split(encryptor.encrypt(record.toPlaintext()));
    }

    public AdminControlRecord openAdminControl(String fullCiphertext) {
        return AdminControlRecord.parse(decrypt(fullCiphertext));
    }

    public ReadReceiptRecord openReadReceipt(String fullCiphertext) {
        return ReadReceiptRecord.parse(decrypt(fullCiphertext));
    }

    static SplitToken split(String encoded) {
        if (encoded.length() <= SPLIT_LENGTH) {
            throw new IllegalStateException("Encrypted token of length " + encoded.length()
                    + " cannot be split at " + SPLIT_LENGTH);
        }
        return new SplitToken(
                encoded.substring(0, SPLIT_LENGTH),
                encoded.substring(encoded.length() - SPLIT_LENGTH),
                encoded.substring(0, encoded.length() - SPLIT_LENGTH));
    }

    private String decrypt(String fullCiphertext) {
        try {
            return encryptor.decrypt(fullCiphertext);
        } catch (EncryptionException e) {
            throw new InvalidMessageDataException("Token failed authentication", e);
        }
    }
}
