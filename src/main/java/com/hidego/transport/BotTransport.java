package com.hidego.transport;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Bot API operations for a single bot credential. Every call is a fallible remote call
 * that signals {@link TransportException} on failure.
 */
public interface BotTransport {

    Mono<User> getMe();

    Mono<WebhookInfo> getWebhookInfo();

    Mono<Void> setWebhook(String url, String secretToken, List<String> allowedUpdates);

    Mono<Void> deleteWebhook();

    Mono<Message> sendMessage(OutboundMessage message);

    /** Copies a message without a link to its origin; emits the new message id. */
    Mono<Long> copyMessage(long chatId, long fromChatId, long messageId,
                           Long replyToMessageId, InlineKeyboard keyboard);

    Mono<Message> forwardMessage(long chatId, long fromChatId, long messageId);

    /** A null keyboard removes the message's buttons. */
    Mono<Void> editMessageText(long chatId, long messageId, String text,
                               String parseMode, InlineKeyboard keyboard);

    Mono<Void> editMessageReplyMarkup(long chatId, long messageId, InlineKeyboard keyboard);

    Mono<Void> setMessageReaction(long chatId, long messageId, String emoji);

    Mono<Void> deleteMessage(long chatId, long messageId);

    Mono<Void> pinChatMessage(long chatId, long messageId);

    Mono<Void> unpinChatMessage(long chatId, long messageId);

    Mono<Chat> getChat(long chatId);

    Mono<Void> answerCallbackQuery(String callbackQueryId, String text, boolean showAlert);

    Mono<Void> setMyCommands(List<BotCommand> commands, String languageCode);

    Mono<Void> setMyShortDescription(String shortDescription, String languageCode);

    Mono<Void> setMyDescription(String description, String languageCode);

    /** Releases the transport; later calls fail. */
    void close();
}
