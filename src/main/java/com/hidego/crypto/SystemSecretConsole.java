package com.hidego.crypto;

import java.io.Console;

public class SystemSecretConsole implements SecretConsole {

    private final Console console;

    public SystemSecretConsole() {
        this.console = System.console();
        if (console == null) {
            throw new IllegalStateException(
                    "No interactive console available to read the master passphrase");
        }
    }

    @Override
    public char[] readSecret(String prompt) {
        return console.readPassword("%s", prompt);
    }

    @Override
    public void println(String line) {
        console.printf("%s%n", line);
        console.flush();
    }
}
