package com.hidego.crypto;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PassphrasePromptTest {

    @TempDir
    Path dir;

    @Test
    void firstRunWritesRecordAfterConfirmation() throws Exception {
        Path record = dir.resolve("config.secure");
        ScriptedConsole console = new ScriptedConsole("long enough secret", "long enough secret");

        Optional<MasterPassphrase> result = new PassphrasePrompt(console, record).obtain();

        assertTrue(result.isPresent());
        assertEquals("long enough secret", new String(result.get().chars()));
        assertEquals(64, Files.size(record));
    }

    @Test
    void firstRunRejectsShortAndMismatchedEntries() {
        Path record = dir.resolve("config.secure");
        ScriptedConsole console = new ScriptedConsole(
                "short",
                "long enough secret", "long enough secreT",
                "long enough secret", "long enough secret");

        Optional<MasterPassphrase> result = new PassphrasePrompt(console, record).obtain();

        assertTrue(result.isPresent());
        assertTrue(console.output.stream().anyMatch(l -> l.contains("at least")));
        assertTrue(console.output.stream().anyMatch(l -> l.contains("do not match")));
    }

    @Test
    void existingRecordAcceptsCorrectPassphrase() {
        Path record = dir.resolve("config.secure");
        new PassphrasePrompt(new ScriptedConsole("long enough secret", "long enough secret"), record).obtain();

        ScriptedConsole console = new ScriptedConsole("wrong passphrase!!", "long enough secret");
        Optional<MasterPassphrase> result = new PassphrasePrompt(console, record).obtain();

        assertTrue(result.isPresent());
        assertTrue(console.output.stream().anyMatch(l -> l.contains("2 attempt(s) left")));
    }

    @Test
    void existingRecordGivesUpAfterThreeFailures() {
        Path record = dir.resolve("config.secure");
        new PassphrasePrompt(new ScriptedConsole("long enough secret", "long enough secret"), record).obtain();

        ScriptedConsole console = new ScriptedConsole("bad one", "bad two", "bad three", "long enough secret");
        assertTrue(new PassphrasePrompt(console, record).obtain().isEmpty());
    }

    @Test
    void exitWordAborts() {
        ScriptedConsole console = new ScriptedConsole("q");
        assertTrue(new PassphrasePrompt(console, dir.resolve("config.secure")).obtain().isEmpty());
        assertFalse(Files.exists(dir.resolve("config.secure")));
    }

    @Test
    void corruptRecordFailsStartup() throws Exception {
        Path record = dir.resolve("config.secure");
        Files.write(record, new byte[10]);

        PassphrasePrompt prompt = new PassphrasePrompt(new ScriptedConsole("anything"), record);
        assertThrows(IllegalStateException.class, prompt::obtain);
    }

    private static final class ScriptedConsole implements SecretConsole {
        private final Deque<String> inputs;
        private final List<String> output = new ArrayList<>();

        ScriptedConsole(String... inputs) {
            this.inputs = new ArrayDeque<>(List.of(inputs));
        }

        @Override
        public char[] readSecret(String prompt) {
            String next = inputs.poll();
            return next != null ? next.toCharArray() : null;
        }

        @Override
        public void println(String line) {
            output.add(line);
        }
    }
}
