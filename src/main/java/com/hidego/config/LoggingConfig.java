package com.hidego.config;

import com.hidego.observability.TokenRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Hands the log redaction converter its extra patterns: the webhook secret as a
 * literal, plus whatever hidego.logging.redact-patterns lists. Bot tokens are
 * masked by the converter itself.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final HidegoProperties properties;
    private final SecretsConfig secrets;

    public LoggingConfig(HidegoProperties properties, SecretsConfig secrets) {
        this.properties = properties;
        this.secrets = secrets;
    }

    @PostConstruct
    public void installRedactionPatterns() {
        List<String> patterns = new ArrayList<>();
        String webhookSecret = secrets.getWebhookSecretToken();
        if (webhookSecret != null && !webhookSecret.isBlank()) {
            patterns.add(Pattern.quote(webhookSecret));
        }

        List<String> configured = properties.getLogging().getRedactPatterns();
        if (configured != null) {
            for (int i = 0; i < configured.size(); i++) {
                String candidate = configured.get(i);
                try {
                    Pattern.compile(candidate);
                } catch (PatternSyntaxException e) {
                    throw new IllegalStateException(
                            "hidego.logging.redact-patterns[" + i + "] is not a valid regex: " + e.getDescription(), e);
                }
                patterns.add(candidate);
            }
        }

        TokenRedactionConverter.setConfiguredPatterns(patterns);
        log.info("Log redaction: bot tokens plus {} extra pattern(s)", patterns.size());
    }
}
