package com.hidego.support;

import com.hidego.transport.BotCommand;
import com.hidego.transport.BotTransport;
import com.hidego.transport.Chat;
import com.hidego.transport.InlineKeyboard;
import com.hidego.transport.Message;
import com.hidego.transport.OutboundMessage;
import com.hidego.transport.TransportErrorKind;
import com.hidego.transport.TransportException;
import com.hidego.transport.User;
import com.hidego.transport.WebhookInfo;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records every platform call. Failures are scripted per method with {@link #failNext}.
 */
public class FakeBotTransport implements BotTransport {

    public record Sent(long messageId, OutboundMessage message) {}
    public record Copy(long chatId, long fromChatId, long messageId, Long replyTo, InlineKeyboard keyboard, long newId) {}
    public record Forward(long chatId, long fromChatId, long messageId, long newId) {}
    public record Edit(long chatId, long messageId, String text, String parseMode, InlineKeyboard keyboard) {}
    public record MarkupEdit(long chatId, long messageId, InlineKeyboard keyboard) {}
    public record Reaction(long chatId, long messageId, String emoji) {}
    public record CallbackAnswer(String queryId, String text, boolean alert) {}
    public record MessageRef(long chatId, long messageId) {}

    private final User identity;
    private final AtomicLong nextMessageId = new AtomicLong(1000);
    private final Map<String, Deque<TransportErrorKind>> scriptedFailures = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger getMeCalls = new AtomicInteger();
    private final AtomicInteger deleteWebhookCalls = new AtomicInteger();
    private volatile String webhookUrl = "";
    private volatile String webhookSecret;
    private volatile Message pinnedMessage;

    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    public final List<Copy> copies = new CopyOnWriteArrayList<>();
    public final List<Forward> forwards = new CopyOnWriteArrayList<>();
    public final List<Edit> edits = new CopyOnWriteArrayList<>();
    public final List<MarkupEdit> markupEdits = new CopyOnWriteArrayList<>();
    public final List<Reaction> reactions = new CopyOnWriteArrayList<>();
    public final List<CallbackAnswer> answers = new CopyOnWriteArrayList<>();
    public final List<MessageRef> deleted = new CopyOnWriteArrayList<>();
    public final List<MessageRef> pins = new CopyOnWriteArrayList<>();
    public final List<MessageRef> unpins = new CopyOnWriteArrayList<>();
    public final List<BotCommand> commands = new CopyOnWriteArrayList<>();

    public FakeBotTransport(User identity) {
        this.identity = identity;
    }

    public static FakeBotTransport forBot(long id, String username) {
        return new FakeBotTransport(new User(id, true, username, null, username, null));
    }

    /** The next calls of {@code method} fail with {@code kinds}, in order. */
    public FakeBotTransport failNext(String method, TransportErrorKind... kinds) {
        Deque<TransportErrorKind> queue = scriptedFailures.computeIfAbsent(method, m -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addAll(List.of(kinds));
        }
        return this;
    }

    public void setPinnedMessage(Message message) {
        this.pinnedMessage = message;
    }

    public void setWebhookUrl(String url) {
        this.webhookUrl = url;
    }

    public String webhookUrl() { return webhookUrl; }
    public String webhookSecret() { return webhookSecret; }
    public boolean isClosed() { return closed.get(); }
    public int getMeCalls() { return getMeCalls.get(); }
    public int deleteWebhookCalls() { return deleteWebhookCalls.get(); }

    public List<Sent> sentTo(long chatId) {
        return sent.stream().filter(s -> s.message().chatId() == chatId).toList();
    }

    public Sent lastSentTo(long chatId) {
        List<Sent> toChat = sentTo(chatId);
        return toChat.isEmpty() ? null : toChat.get(toChat.size() - 1);
    }

    public CallbackAnswer lastAnswer() {
        return answers.isEmpty() ? null : answers.get(answers.size() - 1);
    }

    public Edit lastEdit() {
        return edits.isEmpty() ? null : edits.get(edits.size() - 1);
    }

    private <T> Mono<T> attempt(String method, java.util.function.Supplier<T> action) {
        return Mono.defer(() -> {
            Deque<TransportErrorKind> queue = scriptedFailures.get(method);
            TransportErrorKind failure = null;
            if (queue != null) {
                synchronized (queue) {
                    failure = queue.poll();
                }
            }
            if (failure != null) {
                return Mono.error(new TransportException(failure, method, "scripted failure"));
            }
            return Mono.justOrEmpty(action.get());
        });
    }

    @Override
    public Mono<User> getMe() {
        return attempt("getMe", () -> {
            getMeCalls.incrementAndGet();
            return identity;
        });
    }

    @Override
    public Mono<WebhookInfo> getWebhookInfo() {
        return attempt("getWebhookInfo", () -> new WebhookInfo(webhookUrl, 0, null));
    }

    @Override
    public Mono<Void> setWebhook(String url, String secretToken, List<String> allowedUpdates) {
        return attempt("setWebhook", () -> {
            webhookUrl = url;
            webhookSecret = secretToken;
            return null;
        });
    }

    @Override
    public Mono<Void> deleteWebhook() {
        return attempt("deleteWebhook", () -> {
            deleteWebhookCalls.incrementAndGet();
            webhookUrl = "";
            return null;
        });
    }

    @Override
    public Mono<Message> sendMessage(OutboundMessage message) {
        return attempt("sendMessage", () -> {
            long id = nextMessageId.incrementAndGet();
            sent.add(new Sent(id, message));
            return new Message(id, identity, new Chat(message.chatId(), "private"), message.text(),
                    null, null, message.keyboard());
        });
    }

    @Override
    public Mono<Long> copyMessage(long chatId, long fromChatId, long messageId, Long replyToMessageId,
                                  InlineKeyboard keyboard) {
        return attempt("copyMessage", () -> {
            long id = nextMessageId.incrementAndGet();
            copies.add(new Copy(chatId, fromChatId, messageId, replyToMessageId, keyboard, id));
            return id;
        });
    }

    @Override
    public Mono<Message> forwardMessage(long chatId, long fromChatId, long messageId) {
        return attempt("forwardMessage", () -> {
            long id = nextMessageId.incrementAndGet();
            forwards.add(new Forward(chatId, fromChatId, messageId, id));
            return new Message(id, null, new Chat(chatId, "private"), null);
        });
    }

    @Override
    public Mono<Void> editMessageText(long chatId, long messageId, String text, String parseMode,
                                      InlineKeyboard keyboard) {
        return attempt("editMessageText", () -> {
            edits.add(new Edit(chatId, messageId, text, parseMode, keyboard));
            return null;
        });
    }

    @Override
    public Mono<Void> editMessageReplyMarkup(long chatId, long messageId, InlineKeyboard keyboard) {
        return attempt("editMessageReplyMarkup", () -> {
            markupEdits.add(new MarkupEdit(chatId, messageId, keyboard));
            return null;
        });
    }

    @Override
    public Mono<Void> setMessageReaction(long chatId, long messageId, String emoji) {
        return attempt("setMessageReaction", () -> {
            reactions.add(new Reaction(chatId, messageId, emoji));
            return null;
        });
    }

    @Override
    public Mono<Void> deleteMessage(long chatId, long messageId) {
        return attempt("deleteMessage", () -> {
            deleted.add(new MessageRef(chatId, messageId));
            return null;
        });
    }

    @Override
    public Mono<Void> pinChatMessage(long chatId, long messageId) {
        return attempt("pinChatMessage", () -> {
            pins.add(new MessageRef(chatId, messageId));
            return null;
        });
    }

    @Override
    public Mono<Void> unpinChatMessage(long chatId, long messageId) {
        return attempt("unpinChatMessage", () -> {
            unpins.add(new MessageRef(chatId, messageId));
            return null;
        });
    }

    @Override
    public Mono<Chat> getChat(long chatId) {
        return attempt("getChat", () -> new Chat(chatId, "private", pinnedMessage));
    }

    @Override
    public Mono<Void> answerCallbackQuery(String callbackQueryId, String text, boolean showAlert) {
        return attempt("answerCallbackQuery", () -> {
            answers.add(new CallbackAnswer(callbackQueryId, text, showAlert));
            return null;
        });
    }

    @Override
    public Mono<Void> setMyCommands(List<BotCommand> commands, String languageCode) {
        return attempt("setMyCommands", () -> {
            this.commands.addAll(commands);
            return null;
        });
    }

    @Override
    public Mono<Void> setMyShortDescription(String shortDescription, String languageCode) {
        return attempt("setMyShortDescription", () -> null);
    }

    @Override
    public Mono<Void> setMyDescription(String description, String languageCode) {
        return attempt("setMyDescription", () -> null);
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
