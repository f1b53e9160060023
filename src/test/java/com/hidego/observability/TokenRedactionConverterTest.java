package com.hidego.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenRedactionConverterTest {

    @AfterEach
    void reset() {
        TokenRedactionConverter.setConfiguredPatterns(List.of());
    }

    @Test
    void botTokensAreShortened() {
        String redacted = TokenRedactionConverter.redact(
                "Runtime created for 123456789:AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsaw now");

        assertEquals("Runtime created for 1234...Dsaw now", redacted);
    }

    @Test
    void shortColonValuesAreLeftAlone() {
        assertEquals("at 12:30 ok", TokenRedactionConverter.redact("at 12:30 ok"));
    }

    @Test
    void configuredPatternsAreReplaced() {
        TokenRedactionConverter.setConfiguredPatterns(List.of("passphrase=\\S+"));

        assertEquals("login [REDACTED] done", TokenRedactionConverter.redact("login passphrase=hunter2 done"));
    }

    @Test
    void nullMessageBecomesEmpty() {
        assertEquals("", TokenRedactionConverter.redact(null));
    }
}
