package com.hidego.crypto;

import java.util.Arrays;

/**
 * The process-wide master passphrase. Held as a char array and handed out as copies.
 */
public final class MasterPassphrase {

    private final char[] secret;

    public MasterPassphrase(char[] secret) {
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("Master passphrase must not be empty");
        }
        this.secret = Arrays.copyOf(secret, secret.length);
    }

    public char[] chars() {
        return Arrays.copyOf(secret, secret.length);
    }

    @Override
    public String toString() {
        return "MasterPassphrase[****]";
    }
}
