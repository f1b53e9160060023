package com.hidego.correlation;

import java.util.Optional;

/**
 * How an end-user's message is delivered to the admin.
 */
public enum AnonymityChoice {

    NO_HISTORY("NoHistory"),
    WITH_HISTORY("WithHistory"),
    FORWARD("Forward");

    private final String option;

    AnonymityChoice(String option) {
        this.option = option;
    }

    /** Value stored inside admin-control records. */
    public String option() {
        return option;
    }

    public String callbackData() {
        return CallbackData.ANONYMOUS_PREFIX + option;
    }

    public static Optional<AnonymityChoice> fromCallbackData(String data) {
        if (data == null || !data.startsWith(CallbackData.ANONYMOUS_PREFIX)) {
            return Optional.empty();
        }
        return fromOption(data.substring(CallbackData.ANONYMOUS_PREFIX.length()));
    }

    public static Optional<AnonymityChoice> fromOption(String option) {
        for (AnonymityChoice choice : values()) {
            if (choice.option.equals(option)) {
                return Optional.of(choice);
            }
        }
        return Optional.empty();
    }
}
