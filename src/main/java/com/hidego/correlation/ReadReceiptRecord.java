package com.hidego.correlation;

import java.util.regex.Pattern;

/**
 * Plaintext behind a Read button: whose message to mark as read.
 */
public record ReadReceiptRecord(long senderUserId, long messageId, long timestampNanos) {

    private static final int FIELD_COUNT = 3;

    public String toPlaintext() {
        return String.join(CallbackData.SEPARATOR,
                Long.toString(senderUserId),
                Long.toString(messageId),
                Long.toString(timestampNanos));
    }

    public static ReadReceiptRecord parse(String plaintext) {
        String[] fields = plaintext.split(Pattern.quote(CallbackData.SEPARATOR), -1);
        if (fields.length != FIELD_COUNT) {
            throw new InvalidMessageDataException("Read receipt record has " + fields.length + " fields");
        }
        try {
            return new ReadReceiptRecord(
                    Long.parseLong(fields[0]),
                    Long.parseLong(fields[1]),
                    Long.parseLong(fields[2]));
        } catch (NumberFormatException e) {
            throw new InvalidMessageDataException("Read receipt record has a non-numeric field", e);
        }
    }
}
