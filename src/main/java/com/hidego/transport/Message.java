package com.hidego.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
        @JsonProperty("message_id") long messageId,
        User from,
        Chat chat,
        String text,
        String caption,
        @JsonProperty("reply_to_message") Message replyToMessage,
        @JsonProperty("reply_markup") InlineKeyboard replyMarkup
) {
    public Message(long messageId, User from, Chat chat, String text) {
        this(messageId, from, chat, text, null, null, null);
    }

    public boolean isCommand() {
        return text != null && text.startsWith("/");
    }

    /**
     * Command name without the slash and without an {@code @botname} suffix.
     */
    public Optional<String> command() {
        if (!isCommand()) {
            return Optional.empty();
        }
        String head = text.substring(1).split("\\s+", 2)[0];
        int at = head.indexOf('@');
        return Optional.of(at >= 0 ? head.substring(0, at) : head);
    }

    /** Text after the command, empty when there is none. */
    public String commandArguments() {
        if (!isCommand()) {
            return "";
        }
        String[] parts = text.trim().split("\\s+", 2);
        return parts.length > 1 ? parts[1].trim() : "";
    }

    public String textOrCaption() {
        return text != null ? text : caption;
    }
}
