package com.hidego.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hidego.config.HidegoProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class TelegramTransportFactory implements BotTransportFactory {

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final HidegoProperties properties;

    public TelegramTransportFactory(WebClient.Builder webClientBuilder,
                                    ObjectMapper objectMapper,
                                    HidegoProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public BotTransport create(String credentialToken) {
        HidegoProperties.TransportProperties transport = properties.getTransport();
        return new TelegramBotApiClient(webClientBuilder, objectMapper,
                transport.getApiBaseUrl(), credentialToken, transport.getRequestTimeout());
    }
}
