package com.hidego.routing;

import com.hidego.correlation.AnonymityChoice;
import com.hidego.correlation.CallbackTokens;
import com.hidego.correlation.ReadReceiptRecord;
import com.hidego.correlation.SplitToken;
import com.hidego.i18n.ResponseKey;
import com.hidego.i18n.ResponseTexts;
import com.hidego.observability.RelayMetrics;
import com.hidego.session.AdminReplyCoordinator;
import com.hidego.session.AdminReplySession;
import com.hidego.session.ReplySlot;
import com.hidego.store.HashTable;
import com.hidego.store.RelayStore;
import com.hidego.transport.BotTransport;
import com.hidego.transport.InlineButton;
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

import java.util.List;

/**
 * Classifies a plain message sent to a tenant bot, in this order: the admin's reply
 * (or a reminder to use Answer), a blocked sender's notice, or the anonymity
 * choice prompt for everyone else.
 */
@Component
public class MessageRouter implements UpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final RelayStore store;
    private final AdminReplyCoordinator replies;
    private final CallbackTokens tokens;
    private final ResponseTexts texts;
    private final RelayMetrics metrics;

    public MessageRouter(RelayStore store, AdminReplyCoordinator replies, CallbackTokens tokens,
                         ResponseTexts texts, RelayMetrics metrics) {
        this.store = store;
        this.replies = replies;
        this.tokens = tokens;
        this.texts = texts;
        this.metrics = metrics;
    }

    @Override
    public Mono<Void> handle(UpdateContext context) {
        Message message = context.message();
        User sender = context.sender();
        if (message == null || sender == null) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> store.isAdmin(sender.id(), context.botUsername()))
                .flatMap(admin -> {
                    if (admin) {
                        return fromAdmin(context, message, sender);
                    }
                    return Mono.fromCallable(() -> store.isUserBlocked(sender.id(), context.botUsername()))
                            .flatMap(blocked -> blocked
                                    ? notify(context, message, ResponseKey.USER_BLOCKED)
                                    : promptForChoice(context, message));
                });
    }

    private Mono<Void> fromAdmin(UpdateContext context, Message message, User admin) {
        AdminReplySession session = replies.active(new ReplySlot(admin.id(), context.botUsername()));
        if (session == null) {
            return notify(context, message, ResponseKey.MUST_USE_ANSWER_BUTTON);
        }
        return deliverReply(context, message, session);
    }

    private Mono<Void> promptForChoice(UpdateContext context, Message message) {
        String lang = context.languageCode();
        InlineKeyboard choices = InlineKeyboard.of(
                List.of(InlineButton.callback(texts.get(ResponseKey.CHOICE_NO_HISTORY, lang),
                        AnonymityChoice.NO_HISTORY.callbackData())),
                List.of(InlineButton.callback(texts.get(ResponseKey.CHOICE_WITH_HISTORY, lang),
                        AnonymityChoice.WITH_HISTORY.callbackData())),
                List.of(InlineButton.callback(texts.get(ResponseKey.CHOICE_FORWARD, lang),
                        AnonymityChoice.FORWARD.callbackData())));
        return context.transport()
                .sendMessage(OutboundMessage.text(message.chat().id(), texts.get(ResponseKey.CHOICE_PROMPT, lang))
                        .replyingTo(message.messageId())
                        .withKeyboard(choices))
                .then();
    }

    /**
     * Copies the admin's message to the session's target, threaded onto the original
     * message and carrying a Read button. A missing original drops the threading,
     * uncopyable content falls back to its text.
     */
    private Mono<Void> deliverReply(UpdateContext context, Message reply, AdminReplySession session) {
        BotTransport transport = context.transport();
        long adminChat = reply.chat().id();
        long target = session.getTargetUserId();
        SplitToken read;
        try {
            read = tokens.issueReadReceipt(new ReadReceiptRecord(adminChat, reply.messageId(), System.nanoTime()));
        } catch (RuntimeException e) {
            log.error("Could not issue read-receipt token on @{}", context.botUsername(), e);
            return notify(context, reply, ResponseKey.REPLY_FAILED_RETRY);
        }
        InlineKeyboard keyboard = AdminControlPanel.readOnly(read);

        Mono<Long> delivery = transport.copyMessage(target, adminChat, reply.messageId(),
                        session.getOriginalMessageId(), keyboard)
                .onErrorResume(e -> TransportException.isKind(e, TransportErrorKind.BAD_REQUEST),
                        e -> transport.copyMessage(target, adminChat, reply.messageId(), null, keyboard))
                .onErrorResume(e -> TransportException.isKind(e, TransportErrorKind.BAD_REQUEST),
                        e -> transport.sendMessage(OutboundMessage.text(target, fallbackText(context, reply))
                                        .withKeyboard(keyboard))
                                .map(Message::messageId));

        return delivery
                .onErrorResume(e -> {
                    tokens.discard(read.prefix(), HashTable.READS);
                    return replyFailed(context, reply, session, e).then(Mono.<Long>empty());
                })
                .flatMap(delivered -> {
                    replies.finish(session);
                    metrics.recordReply("sent");
                    log.debug("Reply delivered on @{}", context.botUsername());
                    return confirmReply(context, reply, session);
                });
    }

    /** The reply is already with the user; a lost confirmation is only logged. */
    private Mono<Void> confirmReply(UpdateContext context, Message reply, AdminReplySession session) {
        return notify(context, reply, ResponseKey.REPLY_SENT)
                .onErrorResume(e -> {
                    log.warn("Could not confirm reply on @{}: {}", context.botUsername(), e.getMessage());
                    return Mono.empty();
                })
                .then(deletePrompt(context.transport(), session));
    }

    private Mono<Void> replyFailed(UpdateContext context, Message reply, AdminReplySession session, Throwable error) {
        BotTransport transport = context.transport();
        if (error instanceof TransportException te && te.kind().isTransient()) {
            log.warn("Reply on @{} not delivered, keeping session: {}", context.botUsername(), te.getMessage());
            metrics.recordReply("retry");
            return notify(context, reply, ResponseKey.REPLY_FAILED_RETRY);
        }
        replies.finish(session);
        if (TransportException.isKind(error, TransportErrorKind.FORBIDDEN)) {
            metrics.recordReply("recipient_blocked");
            return notify(context, reply, ResponseKey.REPLY_FAILED_RECIPIENT_BLOCKED_BOT)
                    .then(deletePrompt(transport, session));
        }
        log.warn("Reply on @{} failed: {}", context.botUsername(), error.getMessage());
        metrics.recordReply("failed");
        return notify(context, reply, ResponseKey.REPLY_FAILED).then(deletePrompt(transport, session));
    }

    private Mono<Void> deletePrompt(BotTransport transport, AdminReplySession session) {
        Long prompt = session.getPromptMessageId();
        if (prompt == null) {
            return Mono.empty();
        }
        return transport.deleteMessage(session.getChatId(), prompt)
                .onErrorResume(e -> {
                    log.debug("Reply prompt already gone: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private String fallbackText(UpdateContext context, Message message) {
        String text = message.textOrCaption();
        return text != null && !text.isBlank()
                ? text
                : texts.get(ResponseKey.UNSUPPORTED_CONTENT, context.languageCode());
    }

    private Mono<Void> notify(UpdateContext context, Message message, ResponseKey key) {
        return context.transport()
                .sendMessage(OutboundMessage.text(message.chat().id(), texts.get(key, context.languageCode()))
                        .replyingTo(message.messageId()))
                .then();
    }
}
