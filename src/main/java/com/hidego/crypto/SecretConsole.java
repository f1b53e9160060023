package com.hidego.crypto;

/**
 * Interactive terminal used to obtain the master passphrase.
 */
public interface SecretConsole {

    /**
     * Reads a line without echo. Returns null at end of input.
     */
    char[] readSecret(String prompt);

    void println(String line);
}
