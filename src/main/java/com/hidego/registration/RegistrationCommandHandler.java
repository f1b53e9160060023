package com.hidego.registration;

import com.hidego.i18n.ResponseKey;
import com.hidego.i18n.ResponseTexts;
import com.hidego.routing.UpdateContext;
import com.hidego.store.RelayStore;
import com.hidego.tenant.RuntimeCreationException;
import com.hidego.tenant.TenantRuntime;
import com.hidego.tenant.TenantRuntimeManager;
import com.hidego.transport.BotTokens;
import com.hidego.transport.BotTransport;
import com.hidego.transport.InlineButton;
import com.hidego.transport.InlineKeyboard;
import com.hidego.transport.Message;
import com.hidego.transport.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * Commands of the dispatcher bot: registering a tenant bot from its token, revoking
 * it through the pinned registration message, and the static texts.
 */
@Component
public class RegistrationCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(RegistrationCommandHandler.class);

    static final String TOKEN_LINE = "Token:";

    private final TenantRuntimeManager manager;
    private final RelayStore store;
    private final ResponseTexts texts;

    public RegistrationCommandHandler(TenantRuntimeManager manager, RelayStore store, ResponseTexts texts) {
        this.manager = manager;
        this.store = store;
        this.texts = texts;
    }

    public Mono<Void> start(UpdateContext context) {
        return reply(context, OutboundMessage.text(chatId(context), text(context, ResponseKey.WELCOME)).html().noPreview());
    }

    public Mono<Void> privacy(UpdateContext context) {
        return reply(context, OutboundMessage.text(chatId(context), text(context, ResponseKey.PRIVACY)).html());
    }

    public Mono<Void> about(UpdateContext context) {
        return reply(context, OutboundMessage.text(chatId(context), text(context, ResponseKey.ABOUT)).html().noPreview());
    }

    public Mono<Void> register(UpdateContext context) {
        Message message = context.message();
        String arguments = message.commandArguments();
        if (arguments.isEmpty()) {
            return reply(context, OutboundMessage.text(chatId(context), text(context, ResponseKey.PROVIDE_TOKEN)).html());
        }
        Optional<String> extracted = BotTokens.extract(arguments);
        if (extracted.isEmpty()) {
            return plain(context, ResponseKey.INVALID_TOKEN);
        }
        String token = extracted.get();
        if (manager.isLive(token)) {
            return plain(context, ResponseKey.ALREADY_REGISTERED);
        }

        BotTransport transport = context.transport();
        long adminId = message.from().id();
        return transport.sendMessage(OutboundMessage.text(chatId(context), text(context, ResponseKey.WAIT_REGISTERING_BOT)))
                .flatMap(progress -> Mono.fromCallable(() -> manager.getOrCreateRuntime(token))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(runtime -> Mono.fromCallable(
                                        () -> store.addTenantRegistration(token, runtime.getBotUsername(), adminId))
                                .flatMap(added -> editProgress(context, progress,
                                        text(context, added ? ResponseKey.ADMIN_REGISTERED : ResponseKey.ALREADY_ADMIN)))
                                .then(announce(context, runtime, token)))
                        .onErrorResume(RuntimeCreationException.class, e -> {
                            log.warn("Registration of {} failed: {}", BotTokens.shorten(token), e.getMessage());
                            return editProgress(context, progress,
                                    text(context, ResponseKey.REGISTRATION_FAILED, e.getMessage()));
                        }));
    }

    public Mono<Void> revoke(UpdateContext context) {
        Message message = context.message();
        Message replied = message.replyToMessage();
        if (replied == null) {
            return plain(context, ResponseKey.REVOKE_INSTRUCTIONS);
        }
        BotTransport transport = context.transport();
        long chatId = chatId(context);
        return transport.getChat(chatId)
                .flatMap(chat -> {
                    Message pinned = chat.pinnedMessage();
                    if (pinned == null || pinned.messageId() != replied.messageId()) {
                        return plain(context, ResponseKey.REVOKE_INSTRUCTIONS);
                    }
                    Optional<String> token = tokenFromRegistrationMessage(pinned.textOrCaption());
                    if (token.isEmpty()) {
                        return plain(context, ResponseKey.INVALID_PINNED_MESSAGE);
                    }
                    return manager.revoke(token.get())
                            .then(transport.unpinChatMessage(chatId, pinned.messageId())
                                    .onErrorResume(e -> {
                                        log.debug("Could not unpin registration message: {}", e.getMessage());
                                        return Mono.empty();
                                    }))
                            .then(plain(context, ResponseKey.REVOKE_SUCCESS));
                })
                .onErrorResume(e -> {
                    log.warn("Revocation failed: {}", e.getMessage());
                    return plain(context, ResponseKey.REVOKE_ERROR);
                });
    }

    /** The token on the line after {@value #TOKEN_LINE} in a registration success message. */
    static Optional<String> tokenFromRegistrationMessage(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int marker = text.indexOf(TOKEN_LINE);
        if (marker < 0) {
            return Optional.empty();
        }
        return BotTokens.extract(text.substring(marker + TOKEN_LINE.length()));
    }

    private Mono<Void> announce(UpdateContext context, TenantRuntime runtime, String token) {
        String username = runtime.getBotUsername();
        InlineKeyboard startButton = InlineKeyboard.single(InlineButton.link(
                text(context, ResponseKey.BOT_REGISTERED_SUCCESS_BUTTON), "https://t.me/" + username));
        long chatId = chatId(context);
        return context.transport()
                .sendMessage(OutboundMessage.text(chatId, text(context, ResponseKey.BOT_REGISTERED_SUCCESS, username, token))
                        .html()
                        .withKeyboard(startButton))
                .flatMap(success -> context.transport().pinChatMessage(chatId, success.messageId())
                        .onErrorResume(e -> {
                            log.warn("Could not pin registration of @{}: {}", username, e.getMessage());
                            return Mono.empty();
                        }));
    }

    private Mono<Void> editProgress(UpdateContext context, Message progress, String text) {
        return context.transport().editMessageText(progress.chat().id(), progress.messageId(), text, null, null);
    }

    private Mono<Void> plain(UpdateContext context, ResponseKey key) {
        return reply(context, OutboundMessage.text(chatId(context), text(context, key)));
    }

    private Mono<Void> reply(UpdateContext context, OutboundMessage message) {
        return context.transport().sendMessage(message.replyingTo(context.message().messageId())).then();
    }

    private String text(UpdateContext context, ResponseKey key, Object... args) {
        return texts.get(key, context.languageCode(), args);
    }

    private static long chatId(UpdateContext context) {
        return context.message().chat().id();
    }
}
