package com.hidego.correlation;

/**
 * A callback token that cannot be resolved: unknown prefix, tampered or foreign
 * ciphertext, or a malformed record.
 */
public class InvalidMessageDataException extends RuntimeException {

    public InvalidMessageDataException(String message) {
        super(message);
    }

    public InvalidMessageDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
