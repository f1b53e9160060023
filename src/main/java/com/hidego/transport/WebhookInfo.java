package com.hidego.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookInfo(
        String url,
        @JsonProperty("pending_update_count") int pendingUpdateCount,
        @JsonProperty("last_error_message") String lastErrorMessage
) {}
