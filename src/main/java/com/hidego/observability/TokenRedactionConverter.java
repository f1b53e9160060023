package com.hidego.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logback converter that masks bot credential tokens in log messages down to
 * their first and last four characters. Extra patterns can be configured via
 * hidego.logging.redact-patterns and pushed through LoggingConfig at startup;
 * their matches are replaced entirely.
 */
public class TokenRedactionConverter extends ClassicConverter {

    private static final Pattern BOT_TOKEN = Pattern.compile("\\d+:[A-Za-z0-9_-]{30,}");

    private static volatile List<Pattern> configuredPatterns = List.of();

    /**
     * Called by LoggingConfig to push configured patterns from application properties.
     */
    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = List.copyOf(compiled);
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redact(event.getFormattedMessage());
    }

    static String redact(String message) {
        if (message == null) return "";

        Matcher matcher = BOT_TOKEN.matcher(message);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String token = matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(
                    token.substring(0, 4) + "..." + token.substring(token.length() - 4)));
        }
        matcher.appendTail(out);

        String redacted = out.toString();
        for (Pattern pattern : configuredPatterns) {
            redacted = pattern.matcher(redacted).replaceAll("[REDACTED]");
        }
        return redacted;
    }
}
