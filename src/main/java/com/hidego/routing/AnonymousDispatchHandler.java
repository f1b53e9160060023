package com.hidego.routing;

import com.hidego.correlation.AdminControlRecord;
import com.hidego.correlation.AnonymityChoice;
import com.hidego.correlation.CallbackTokens;
import com.hidego.correlation.ReadReceiptRecord;
import com.hidego.correlation.SplitToken;
import com.hidego.crypto.AnonymousIdGenerator;
import com.hidego.i18n.ResponseKey;
import com.hidego.i18n.ResponseTexts;
import com.hidego.observability.RelayMetrics;
import com.hidego.store.HashTable;
import com.hidego.store.RelayStore;
import com.hidego.transport.BotTransport;
import com.hidego.transport.CallbackQuery;
import com.hidego.transport.InlineKeyboard;
import com.hidego.transport.Message;
import com.hidego.transport.OutboundMessage;
import com.hidego.transport.TransportErrorKind;
import com.hidego.transport.TransportException;
import com.hidego.transport.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Handles the sender's anonymity choice: mints the admin-control and read-receipt
 * tokens, delivers the original message to the admin followed by the control
 * message, and reports the outcome on the choice prompt.
 */
@Component
public class AnonymousDispatchHandler implements UpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(AnonymousDispatchHandler.class);

    private final RelayStore store;
    private final CallbackTokens tokens;
    private final AnonymousIdGenerator anonymousIds;
    private final ResponseTexts texts;
    private final RelayMetrics metrics;

    public AnonymousDispatchHandler(RelayStore store, CallbackTokens tokens, AnonymousIdGenerator anonymousIds,
                                    ResponseTexts texts, RelayMetrics metrics) {
        this.store = store;
        this.tokens = tokens;
        this.anonymousIds = anonymousIds;
        this.texts = texts;
        this.metrics = metrics;
    }

    @Override
    public Mono<Void> handle(UpdateContext context) {
        CallbackQuery query = context.callbackQuery();
        Message prompt = query.message();
        Optional<AnonymityChoice> choice = AnonymityChoice.fromCallbackData(query.data());
        if (prompt == null || choice.isEmpty()) {
            return answer(context, query, ResponseKey.INVALID_MESSAGE_DATA);
        }
        Message original = prompt.replyToMessage();
        if (original == null) {
            return finish(context, query, prompt, ResponseKey.ORIGINAL_MESSAGE_MISSING);
        }

        return quietEdit(context, prompt, ResponseKey.ENCRYPTING_MESSAGE)
                .then(Mono.fromCallable(() -> store.getAdminIdForTenant(context.botUsername())))
                .flatMap(adminId -> {
                    if (adminId.isEmpty()) {
                        return finish(context, query, prompt, ResponseKey.NO_ADMIN);
                    }
                    if (store.isUserBlocked(query.from().id(), context.botUsername())) {
                        return finish(context, query, prompt, ResponseKey.USER_BLOCKED);
                    }
                    return dispatch(context, query, prompt, original, choice.get(), adminId.get());
                });
    }

    private Mono<Void> dispatch(UpdateContext context, CallbackQuery query, Message prompt, Message original,
                                AnonymityChoice choice, long adminId) {
        User sender = query.from();
        long issuedAt = System.nanoTime();
        SplitToken control;
        SplitToken read;
        try {
            control = tokens.issueAdminControl(
                    new AdminControlRecord(choice, adminId, sender.id(), original.messageId(), issuedAt));
        } catch (RuntimeException e) {
            log.error("Could not issue admin-control token on @{}", context.botUsername(), e);
            return finish(context, query, prompt, ResponseKey.ERROR_SENDING_MESSAGE);
        }
        try {
            read = tokens.issueReadReceipt(new ReadReceiptRecord(sender.id(), original.messageId(), issuedAt));
        } catch (RuntimeException e) {
            log.error("Could not issue read-receipt token on @{}", context.botUsername(), e);
            tokens.discard(control.prefix(), HashTable.MESSAGES);
            return finish(context, query, prompt, ResponseKey.ERROR_SENDING_MESSAGE);
        }

        String controlText = AdminControlPanel.controlText(choice,
                choice == AnonymityChoice.WITH_HISTORY ? anonymousIds.conversationId(sender.id(), sender.firstName()) : null,
                sender.displayName());
        InlineKeyboard keyboard = AdminControlPanel.keyboard(read, control, false);

        Mono<Boolean> delivered = deliverContent(context, adminId, original, choice)
                .flatMap(deliveredId -> context.transport().sendMessage(
                        OutboundMessage.text(adminId, controlText).html()
                                .replyingTo(deliveredId)
                                .withKeyboard(keyboard)))
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.warn("Dispatch on @{} failed: {}", context.botUsername(), e.getMessage());
                    tokens.discard(control.prefix(), HashTable.MESSAGES);
                    tokens.discard(read.prefix(), HashTable.READS);
                    return Mono.just(false);
                });

        // tokens are live once the panel is delivered
        return delivered.flatMap(ok -> {
            if (!ok) {
                return finish(context, query, prompt, ResponseKey.ERROR_SENDING_MESSAGE);
            }
            metrics.recordDispatch(choice.option());
            log.debug("Message dispatched on @{} as {}", context.botUsername(), choice);
            return finish(context, query, prompt, sentKey(choice));
        });
    }

    /** Copies or forwards the original; content the platform refuses is resent as text. Emits the admin-side id. */
    private Mono<Long> deliverContent(UpdateContext context, long adminId, Message original, AnonymityChoice choice) {
        BotTransport transport = context.transport();
        long fromChat = original.chat().id();
        Mono<Long> delivered = choice == AnonymityChoice.FORWARD
                ? transport.forwardMessage(adminId, fromChat, original.messageId()).map(Message::messageId)
                : transport.copyMessage(adminId, fromChat, original.messageId(), null, null);
        return delivered.onErrorResume(e -> TransportException.isKind(e, TransportErrorKind.BAD_REQUEST), e -> {
            log.debug("Delivering content on @{} failed, sending as text: {}", context.botUsername(), e.getMessage());
            String text = original.textOrCaption();
            return transport.sendMessage(OutboundMessage.text(adminId,
                            text != null && !text.isBlank()
                                    ? text
                                    : texts.get(ResponseKey.UNSUPPORTED_CONTENT, (String) null)))
                    .map(Message::messageId);
        });
    }

    private static ResponseKey sentKey(AnonymityChoice choice) {
        return switch (choice) {
            case NO_HISTORY -> ResponseKey.MESSAGE_SENT_NO_HISTORY;
            case WITH_HISTORY -> ResponseKey.MESSAGE_SENT_WITH_HISTORY;
            case FORWARD -> ResponseKey.MESSAGE_FORWARDED;
        };
    }

    private Mono<Void> finish(UpdateContext context, CallbackQuery query, Message prompt, ResponseKey key) {
        return quietEdit(context, prompt, key).then(answer(context, query, null));
    }

    /** Rewrites the choice prompt and drops its buttons; a failed edit is only logged. */
    private Mono<Void> quietEdit(UpdateContext context, Message prompt, ResponseKey key) {
        return context.transport()
                .editMessageText(prompt.chat().id(), prompt.messageId(),
                        texts.get(key, context.languageCode()), null, null)
                .onErrorResume(e -> {
                    log.debug("Could not edit choice prompt: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> answer(UpdateContext context, CallbackQuery query, ResponseKey key) {
        String text = key == null ? null : texts.get(key, context.languageCode());
        return context.transport().answerCallbackQuery(query.id(), text, false)
                .onErrorResume(e -> {
                    log.debug("Could not answer callback on @{}: {}", context.botUsername(), e.getMessage());
                    return Mono.empty();
                });
    }
}
