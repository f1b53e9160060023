package com.hidego.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecretsConfig {

    @Value("${hidego.secrets.main-bot-token:}")
    private String mainBotToken;

    @Value("${hidego.secrets.webhook-secret-token:}")
    private String webhookSecretToken;

    public String getMainBotToken() { return mainBotToken; }
    public String getWebhookSecretToken() { return webhookSecretToken; }
}
