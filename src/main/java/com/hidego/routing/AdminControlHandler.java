package com.hidego.routing;

import com.hidego.correlation.AdminControlRecord;
import com.hidego.correlation.CallbackData;
import com.hidego.correlation.CallbackPayload;
import com.hidego.correlation.CallbackTokens;
import com.hidego.correlation.InvalidMessageDataException;
import com.hidego.i18n.ResponseKey;
import com.hidego.i18n.ResponseTexts;
import com.hidego.observability.RelayMetrics;
import com.hidego.session.AdminReplyCoordinator;
import com.hidego.session.AdminReplySession;
import com.hidego.session.ReplySlot;
import com.hidego.store.RelayStore;
import com.hidego.transport.BotTransport;
import com.hidego.transport.CallbackQuery;
import com.hidego.transport.InlineButton;
import com.hidego.transport.InlineKeyboard;
import com.hidego.transport.Message;
import com.hidego.transport.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Block, Answer and Cancel buttons of the admin side. Tokens are only honoured for
 * the admin they were issued to.
 */
@Component
public class AdminControlHandler implements UpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(AdminControlHandler.class);

    private final CallbackTokens tokens;
    private final RelayStore store;
    private final AdminReplyCoordinator replies;
    private final ResponseTexts texts;
    private final RelayMetrics metrics;

    public AdminControlHandler(CallbackTokens tokens, RelayStore store, AdminReplyCoordinator replies,
                               ResponseTexts texts, RelayMetrics metrics) {
        this.tokens = tokens;
        this.store = store;
        this.replies = replies;
        this.texts = texts;
        this.metrics = metrics;
    }

    @Override
    public Mono<Void> handle(UpdateContext context) {
        CallbackQuery query = context.callbackQuery();
        if (CallbackData.CANCEL_REPLY.equals(query.data())) {
            return cancel(context, query);
        }

        AdminControlRecord record;
        CallbackPayload payload;
        try {
            payload = CallbackPayload.parse(query.data());
            record = tokens.resolveAdminControl(payload);
        } catch (InvalidMessageDataException e) {
            log.error("Invalid admin-control callback on @{}", context.botUsername(), e);
            metrics.recordInvalidToken("messages");
            return alert(context, query, ResponseKey.INVALID_MESSAGE_DATA);
        }
        if (record.adminId() != query.from().id()) {
            log.warn("Admin-control token used by someone other than its admin on @{}", context.botUsername());
            return alert(context, query, ResponseKey.INVALID_MESSAGE_DATA);
        }

        return switch (payload.operation()) {
            case ANSWER -> answer(context, query, record);
            case BLOCK -> toggleBlock(context, query, record);
            case READ -> alert(context, query, ResponseKey.UNKNOWN_OPERATION);
        };
    }

    private Mono<Void> answer(UpdateContext context, CallbackQuery query, AdminControlRecord record) {
        Message control = query.message();
        if (control == null) {
            return alert(context, query, ResponseKey.REPLY_ERROR);
        }
        BotTransport transport = context.transport();
        String lang = context.languageCode();
        long chatId = control.chat().id();
        long anchor = control.replyToMessage() != null ? control.replyToMessage().messageId() : control.messageId();

        AdminReplySession session = new AdminReplySession(new ReplySlot(query.from().id(), context.botUsername()),
                record.senderUserId(), record.originalMessageId(), chatId, anchor, lang);
        if (!replies.begin(session)) {
            return alert(context, query, ResponseKey.ONGOING_REPLY);
        }

        String wait = texts.get(ResponseKey.REPLY_WAIT, lang, replies.getTimeout().toMinutes());
        InlineKeyboard cancel = InlineKeyboard.single(
                InlineButton.callback(texts.get(ResponseKey.BUTTON_CANCEL_REPLY, lang), CallbackData.CANCEL_REPLY));
        return transport.sendMessage(OutboundMessage.text(chatId, wait).replyingTo(anchor).withKeyboard(cancel))
                .flatMap(prompt -> {
                    session.setPromptMessageId(prompt.messageId());
                    replies.armTimeout(session, () -> transport.editMessageText(chatId, prompt.messageId(),
                            texts.get(ResponseKey.REPLY_TIMEOUT, session.getLanguageCode()), null, null));
                    return toast(context, query, ResponseKey.REPLY_AWAITING);
                })
                .onErrorResume(e -> {
                    log.warn("Could not open reply on @{}: {}", context.botUsername(), e.getMessage());
                    replies.finish(session);
                    return alert(context, query, ResponseKey.REPLY_ERROR);
                });
    }

    private Mono<Void> cancel(UpdateContext context, CallbackQuery query) {
        AdminReplySession canceled = replies.cancel(new ReplySlot(query.from().id(), context.botUsername()));
        if (canceled == null) {
            log.debug("Cancel pressed with no pending reply on @{}", context.botUsername());
        }
        Message prompt = query.message();
        Mono<Void> edit = prompt == null ? Mono.empty()
                : context.transport().editMessageText(prompt.chat().id(), prompt.messageId(),
                        texts.get(ResponseKey.REPLY_CANCELED, context.languageCode()), null, null);
        return edit
                .onErrorResume(e -> {
                    log.debug("Could not edit reply prompt: {}", e.getMessage());
                    return Mono.empty();
                })
                .then(toast(context, query, ResponseKey.REPLY_CANCELED));
    }

    private Mono<Void> toggleBlock(UpdateContext context, CallbackQuery query, AdminControlRecord record) {
        String bot = context.botUsername();
        long user = record.senderUserId();
        boolean wasBlocked = store.isUserBlocked(user, bot);
        boolean changed = wasBlocked ? store.unblockUser(user, bot) : store.blockUser(user, bot);
        if (!changed) {
            return alert(context, query, wasBlocked ? ResponseKey.UNBLOCK_ERROR : ResponseKey.BLOCK_ERROR);
        }
        boolean blocked = !wasBlocked;
        log.info("Sender {} on @{}", blocked ? "blocked" : "unblocked", bot);

        Message control = query.message();
        Mono<Void> rewrite = Mono.empty();
        if (control != null) {
            InlineKeyboard keyboard = control.replyMarkup() != null
                    ? AdminControlPanel.withBlockState(control.replyMarkup(), blocked)
                    : null;
            String text = AdminControlPanel.withBlockedMarker(
                    AdminControlPanel.controlTextFromEcho(record.choice(), control.text()), blocked);
            rewrite = context.transport().editMessageText(control.chat().id(), control.messageId(),
                            text, OutboundMessage.HTML, keyboard)
                    .onErrorResume(e -> {
                        log.warn("Could not rewrite control message on @{}: {}", bot, e.getMessage());
                        return Mono.empty();
                    });
        }
        return rewrite.then(toast(context, query, blocked ? ResponseKey.USER_BLOCKED_DONE : ResponseKey.USER_UNBLOCKED_DONE));
    }

    private Mono<Void> toast(UpdateContext context, CallbackQuery query, ResponseKey key) {
        return context.transport().answerCallbackQuery(query.id(), texts.get(key, context.languageCode()), false);
    }

    private Mono<Void> alert(UpdateContext context, CallbackQuery query, ResponseKey key) {
        return context.transport().answerCallbackQuery(query.id(), texts.get(key, context.languageCode()), true);
    }
}
