package com.hidego.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InlineButton(
        String text,
        @JsonProperty("callback_data") String callbackData,
        String url
) {
    public static InlineButton callback(String text, String callbackData) {
        return new InlineButton(text, callbackData, null);
    }

    public static InlineButton link(String text, String url) {
        return new InlineButton(text, null, url);
    }
}
