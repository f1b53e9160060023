package com.hidego.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BotTransport} over the Telegram Bot API: JSON POSTs to
 * {@code {apiBase}/bot{token}/{method}} answered by {@code {"ok": ..., "result": ...}}.
 */
public class TelegramBotApiClient implements BotTransport {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotApiClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final String shortToken;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TelegramBotApiClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                String apiBaseUrl, String credentialToken, Duration requestTimeout) {
        this.webClient = builder.clone()
                .baseUrl(apiBaseUrl + "/bot" + credentialToken)
                .build();
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.shortToken = BotTokens.shorten(credentialToken);
    }

    @Override
    public Mono<User> getMe() {
        return call("getMe", Map.of(), User.class);
    }

    @Override
    public Mono<WebhookInfo> getWebhookInfo() {
        return call("getWebhookInfo", Map.of(), WebhookInfo.class);
    }

    @Override
    public Mono<Void> setWebhook(String url, String secretToken, List<String> allowedUpdates) {
        Map<String, Object> params = params();
        params.put("url", url);
        putIfPresent(params, "secret_token", secretToken);
        params.put("allowed_updates", allowedUpdates);
        return invoke("setWebhook", params);
    }

    @Override
    public Mono<Void> deleteWebhook() {
        return invoke("deleteWebhook", Map.of());
    }

    @Override
    public Mono<Message> sendMessage(OutboundMessage message) {
        Map<String, Object> params = params();
        params.put("chat_id", message.chatId());
        params.put("text", message.text());
        putIfPresent(params, "parse_mode", message.parseMode());
        putIfPresent(params, "reply_markup", message.keyboard());
        if (message.replyToMessageId() != null) {
            params.put("reply_parameters", Map.of(
                    "message_id", message.replyToMessageId(),
                    "allow_sending_without_reply", true));
        }
        if (message.disableNotification()) {
            params.put("disable_notification", true);
        }
        if (message.disableWebPagePreview()) {
            params.put("link_preview_options", Map.of("is_disabled", true));
        }
        return call("sendMessage", params, Message.class);
    }

    @Override
    public Mono<Long> copyMessage(long chatId, long fromChatId, long messageId,
                                  Long replyToMessageId, InlineKeyboard keyboard) {
        Map<String, Object> params = params();
        params.put("chat_id", chatId);
        params.put("from_chat_id", fromChatId);
        params.put("message_id", messageId);
        if (replyToMessageId != null) {
            params.put("reply_parameters", Map.of("message_id", replyToMessageId));
        }
        putIfPresent(params, "reply_markup", keyboard);
        return call("copyMessage", params, JsonNode.class)
                .map(result -> result.path("message_id").asLong());
    }

    @Override
    public Mono<Message> forwardMessage(long chatId, long fromChatId, long messageId) {
        Map<String, Object> params = params();
        params.put("chat_id", chatId);
        params.put("from_chat_id", fromChatId);
        params.put("message_id", messageId);
        return call("forwardMessage", params, Message.class);
    }

    @Override
    public Mono<Void> editMessageText(long chatId, long messageId, String text,
                                      String parseMode, InlineKeyboard keyboard) {
        Map<String, Object> params = params();
        params.put("chat_id", chatId);
        params.put("message_id", messageId);
        params.put("text", text);
        putIfPresent(params, "parse_mode", parseMode);
        putIfPresent(params, "reply_markup", keyboard);
        return invoke("editMessageText", params);
    }

    @Override
    public Mono<Void> editMessageReplyMarkup(long chatId, long messageId, InlineKeyboard keyboard) {
        Map<String, Object> params = params();
        params.put("chat_id", chatId);
        params.put("message_id", messageId);
        params.put("reply_markup", keyboard != null ? keyboard : new InlineKeyboard(List.of()));
        return invoke("editMessageReplyMarkup", params);
    }

    @Override
    public Mono<Void> setMessageReaction(long chatId, long messageId, String emoji) {
        Map<String, Object> params = params();
        params.put("chat_id", chatId);
        params.put("message_id", messageId);
        params.put("reaction", List.of(Map.of("type", "emoji", "emoji", emoji)));
        return invoke("setMessageReaction", params);
    }

    @Override
    public Mono<Void> deleteMessage(long chatId, long messageId) {
        return invoke("deleteMessage", Map.of("chat_id", chatId, "message_id", messageId));
    }

    @Override
    public Mono<Void> pinChatMessage(long chatId, long messageId) {
        return invoke("pinChatMessage", Map.of("chat_id", chatId, "message_id", messageId));
    }

    @Override
    public Mono<Void> unpinChatMessage(long chatId, long messageId) {
        return invoke("unpinChatMessage", Map.of("chat_id", chatId, "message_id", messageId));
    }

    @Override
    public Mono<Chat> getChat(long chatId) {
        return call("getChat", Map.of("chat_id", chatId), Chat.class);
    }

    @Override
    public Mono<Void> answerCallbackQuery(String callbackQueryId, String text, boolean showAlert) {
        Map<String, Object> params = params();
        params.put("callback_query_id", callbackQueryId);
        putIfPresent(params, "text", text);
        if (showAlert) {
            params.put("show_alert", true);
        }
        return invoke("answerCallbackQuery", params);
    }

    @Override
    public Mono<Void> setMyCommands(List<BotCommand> commands, String languageCode) {
        Map<String, Object> params = params();
        params.put("commands", commands);
        putIfPresent(params, "language_code", languageCode);
        return invoke("setMyCommands", params);
    }

    @Override
    public Mono<Void> setMyShortDescription(String shortDescription, String languageCode) {
        Map<String, Object> params = params();
        params.put("short_description", shortDescription);
        putIfPresent(params, "language_code", languageCode);
        return invoke("setMyShortDescription", params);
    }

    @Override
    public Mono<Void> setMyDescription(String description, String languageCode) {
        Map<String, Object> params = params();
        params.put("description", description);
        putIfPresent(params, "language_code", languageCode);
        return invoke("setMyDescription", params);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Transport for bot {} closed", shortToken);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private Mono<Void> invoke(String method, Map<String, Object> params) {
        return call(method, params, JsonNode.class).then();
    }

    private <T> Mono<T> call(String method, Map<String, Object> params, Class<T> resultType) {
        if (closed.get()) {
            return Mono.error(new IllegalStateException("Transport for bot " + shortToken + " is closed"));
        }
        return webClient.post()
                .uri("/{method}", method)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(params)
                .exchangeToMono(response -> response.bodyToMono(JsonNode.class)
                        .defaultIfEmpty(NullNode.getInstance())
                        .map(body -> unwrap(method, response.statusCode().value(), body, resultType)))
                .timeout(requestTimeout)
                .onErrorMap(TimeoutException.class,
                        e -> new TransportException(TransportErrorKind.TIMEOUT, method, "no response within " + requestTimeout, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new TransportException(TransportErrorKind.NETWORK, method, e.getMessage(), e))
                .onErrorMap(WebClientResponseException.class,
                        e -> new TransportException(TransportErrorKind.fromErrorCode(e.getStatusCode().value()),
                                method, e.getStatusText(), e))
                .doOnError(TransportException.class,
                        e -> log.debug("Bot {} {}", shortToken, e.getMessage()));
    }

    private <T> T unwrap(String method, int status, JsonNode body, Class<T> resultType) {
        if (body.path("ok").asBoolean(false)) {
            JsonNode result = body.path("result");
            if (resultType == JsonNode.class) {
                return resultType.cast(result);
            }
            try {
                return objectMapper.convertValue(result, resultType);
            } catch (IllegalArgumentException e) {
                throw new TransportException(TransportErrorKind.BAD_REQUEST, method,
                        "unreadable result: " + e.getMessage(), e);
            }
        }
        int errorCode = body.path("error_code").asInt(status);
        String description = body.path("description").asText("HTTP " + status);
        throw new TransportException(TransportErrorKind.fromErrorCode(errorCode), method, description);
    }

    private static Map<String, Object> params() {
        return new LinkedHashMap<>();
    }

    private static void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) {
            params.put(key, value);
        }
    }
}
