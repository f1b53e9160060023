package com.hidego.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Update(
        @JsonProperty("update_id") long updateId,
        Message message,
        @JsonProperty("callback_query") CallbackQuery callbackQuery
) {
    public User sender() {
        if (message != null) return message.from();
        if (callbackQuery != null) return callbackQuery.from();
        return null;
    }
}
