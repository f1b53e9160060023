package com.hidego.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Chat(
        long id,
        String type,
        @JsonProperty("pinned_message") Message pinnedMessage
) {
    public Chat(long id, String type) {
        this(id, type, null);
    }
}
