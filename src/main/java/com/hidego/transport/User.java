package com.hidego.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
        long id,
        @JsonProperty("is_bot") boolean bot,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        String username,
        @JsonProperty("language_code") String languageCode
) {
    public String displayName() {
        if (lastName == null || lastName.isBlank()) {
            return firstName != null ? firstName : "";
        }
        return (firstName != null ? firstName + " " : "") + lastName;
    }
}
