package com.hidego.transport;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bot credential token helpers. Tokens are secrets and only ever logged shortened.
 */
public final class BotTokens {

    public static final Pattern TOKEN_PATTERN = Pattern.compile("\\d+:[A-Za-z0-9_-]+");

    private BotTokens() {}

    /** First token-shaped substring of {@code raw}, if any. */
    public static Optional<String> extract(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = TOKEN_PATTERN.matcher(raw);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    public static String shorten(String token) {
        if (token == null) {
            return "null";
        }
        if (token.length() <= 10) {
            return "***";
        }
        return token.substring(0, 4) + "..." + token.substring(token.length() - 4);
    }
}
