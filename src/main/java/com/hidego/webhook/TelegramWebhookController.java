package com.hidego.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hidego.observability.RelayMetrics;
import com.hidego.tenant.RuntimeCreationException;
import com.hidego.tenant.SubmitResult;
import com.hidego.tenant.TenantRuntime;
import com.hidego.tenant.TenantRuntimeManager;
import com.hidego.tenant.UnknownTenantException;
import com.hidego.transport.BotTokens;
import com.hidego.transport.Update;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Receives Telegram webhook updates for every hosted bot. The path carries the
 * bot's credential token; source address and secret header were already checked
 * by {@link WebhookAuthFilter}.
 */
@RestController
@RequestMapping("/webhook")
public class TelegramWebhookController {

    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookController.class);

    static final String RETRY_AFTER_SECONDS = "1";

    private final TenantRuntimeManager manager;
    private final ObjectMapper objectMapper;
    private final RelayMetrics metrics;

    public TelegramWebhookController(TenantRuntimeManager manager, ObjectMapper objectMapper, RelayMetrics metrics) {
        this.manager = manager;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @PostMapping("/{token}")
    @Observed(name = "hidego.webhook.submit", contextualName = "webhook-submit")
    public ResponseEntity<Map<String, String>> receive(@PathVariable String token, @RequestBody String body) {
        Update update;
        try {
            update = objectMapper.readValue(body, Update.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable update for {}: {}", BotTokens.shorten(token), e.getOriginalMessage());
            metrics.recordWebhookUpdate("bad_request");
            return ResponseEntity.badRequest().body(error("Invalid update"));
        }

        TenantRuntime runtime;
        SubmitResult result;
        try {
            runtime = manager.resolveForWebhook(token);
            result = runtime.submit(update);
            if (result == SubmitResult.STOPPED) {
                // evicted between lookup and submit
                runtime = manager.resolveForWebhook(token);
                result = runtime.submit(update);
            }
        } catch (UnknownTenantException e) {
            log.warn("Delivery for unknown bot {}", BotTokens.shorten(token));
            metrics.recordWebhookUpdate("unknown_tenant");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("Unknown bot"));
        } catch (RuntimeCreationException e) {
            metrics.recordWebhookUpdate("creation_failed");
            return ResponseEntity.ok(error("Bot creation failed: " + e.getMessage()));
        }

        return switch (result) {
            case ACCEPTED -> {
                metrics.recordWebhookUpdate("accepted");
                log.debug("Update {} queued for @{}", update.updateId(), runtime.getBotUsername());
                yield ResponseEntity.ok(Map.of("status", "ok"));
            }
            case OVERLOADED -> {
                metrics.recordWebhookUpdate("overloaded");
                yield ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                        .body(error("Queue overloaded"));
            }
            case STOPPED -> {
                metrics.recordWebhookUpdate("stopped");
                yield ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                        .body(error("Bot is restarting"));
            }
        };
    }

    private static Map<String, String> error(String message) {
        return Map.of("status", "error", "message", message);
    }
}
