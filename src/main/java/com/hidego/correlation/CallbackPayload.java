package com.hidego.correlation;

import java.util.regex.Pattern;

/**
 * Parsed {@code code|prefix|suffix} button payload.
 */
public record CallbackPayload(ControlOperation operation, String prefix, String suffix) {

    public static CallbackPayload parse(String data) {
        if (data == null) {
            throw new InvalidMessageDataException("Missing callback data");
        }
        String[] parts = data.split(Pattern.quote(CallbackData.SEPARATOR), -1);
        if (parts.length != 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw new InvalidMessageDataException("Callback data is not a token payload");
        }
        ControlOperation operation = ControlOperation.fromCode(parts[0])
                .orElseThrow(() -> new InvalidMessageDataException("Unknown operation code"));
        return new CallbackPayload(operation, parts[1], parts[2]);
    }
}
