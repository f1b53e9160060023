package com.hidego.transport;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    private Message text(String text) {
        return new Message(1L, null, new Chat(42L, "private"), text);
    }

    @Test
    void commandStripsBotSuffix() {
        assertEquals("register", text("/register@hidego_bot 123:abc").command().orElseThrow());
        assertEquals("123:abc", text("/register@hidego_bot 123:abc").commandArguments());
    }

    @Test
    void plainTextIsNotACommand() {
        assertTrue(text("hello").command().isEmpty());
        assertEquals("", text("hello").commandArguments());
        assertTrue(new Message(1L, null, new Chat(42L, "private"), null).command().isEmpty());
    }

    @Test
    void keyboardWithoutDropsEmptyRows() {
        InlineKeyboard keyboard = InlineKeyboard.of(
                java.util.List.of(InlineButton.callback("Read", "r|p|s")),
                java.util.List.of(InlineButton.callback("Block", "b|p|s"), InlineButton.callback("Answer", "a|p|s")));

        InlineKeyboard trimmed = keyboard.without("r|p|s");

        assertEquals(1, trimmed.rows().size());
        assertTrue(trimmed.findByCallbackPrefix("b|").isPresent());
        assertTrue(trimmed.findByCallbackPrefix("r|").isEmpty());
    }

    @Test
    void tokenExtractionAndShortening() {
        String token = "123456789:AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsaw";
        assertEquals(token, BotTokens.extract("please use " + token + " thanks").orElseThrow());
        assertTrue(BotTokens.extract("no token here").isEmpty());
        assertFalse(BotTokens.shorten(token).contains("AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsaw"));
    }
}
