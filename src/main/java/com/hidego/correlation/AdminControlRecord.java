package com.hidego.correlation;

import java.util.regex.Pattern;

/**
 * Plaintext behind the Block and Answer buttons of an admin control panel.
 */
public record AdminControlRecord(
        AnonymityChoice choice,
        long adminId,
        long senderUserId,
        long originalMessageId,
        long timestampNanos
) {

    private static final int FIELD_COUNT = 5;

    public String toPlaintext() {
        return String.join(CallbackData.SEPARATOR,
                choice.option(),
                Long.toString(adminId),
                Long.toString(senderUserId),
                Long.toString(originalMessageId),
                Long.toString(timestampNanos));
    }

    public static AdminControlRecord parse(String plaintext) {
        String[] fields = plaintext.split(Pattern.quote(CallbackData.SEPARATOR), -1);
        if (fields.length != FIELD_COUNT) {
            throw new InvalidMessageDataException("Admin control record has " + fields.length + " fields");
        }
        AnonymityChoice choice = AnonymityChoice.fromOption(fields[0])
                .orElseThrow(() -> new InvalidMessageDataException("Unknown anonymity option"));
        try {
            return new AdminControlRecord(choice,
                    Long.parseLong(fields[1]),
                    Long.parseLong(fields[2]),
                    Long.parseLong(fields[3]),
                    Long.parseLong(fields[4]));
        } catch (NumberFormatException e) {
            throw new InvalidMessageDataException("Admin control record has a non-numeric field", e);
        }
    }
}
