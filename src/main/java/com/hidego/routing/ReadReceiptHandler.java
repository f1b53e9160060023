package com.hidego.routing;

import com.hidego.correlation.CallbackPayload;
import com.hidego.correlation.CallbackTokens;
import com.hidego.correlation.InvalidMessageDataException;
import com.hidego.correlation.ReadReceiptRecord;
import com.hidego.i18n.ResponseKey;
import com.hidego.i18n.ResponseTexts;
import com.hidego.observability.RelayMetrics;
import com.hidego.store.HashTable;
import com.hidego.transport.BotTransport;
import com.hidego.transport.CallbackQuery;
import com.hidego.transport.InlineKeyboard;
import com.hidego.transport.Message;
import com.hidego.transport.TransportErrorKind;
import com.hidego.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Read button: drops the button, reacts with 👀 on the message it refers to and
 * consumes the read-receipt token.
 */
@Component
public class ReadReceiptHandler implements UpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(ReadReceiptHandler.class);
    static final String READ_REACTION = "👀";

    private final CallbackTokens tokens;
    private final ResponseTexts texts;
    private final RelayMetrics metrics;

    public ReadReceiptHandler(CallbackTokens tokens, ResponseTexts texts, RelayMetrics metrics) {
        this.tokens = tokens;
        this.texts = texts;
        this.metrics = metrics;
    }

    @Override
    public Mono<Void> handle(UpdateContext context) {
        CallbackQuery query = context.callbackQuery();
        BotTransport transport = context.transport();

        Mono<Void> dropButton = removeReadButton(transport, query.message(), query.data());
        CallbackPayload payload;
        ReadReceiptRecord record;
        try {
            payload = CallbackPayload.parse(query.data());
            record = tokens.resolveReadReceipt(payload);
        } catch (InvalidMessageDataException e) {
            log.error("Invalid read-receipt callback on @{}", context.botUsername(), e);
            metrics.recordInvalidToken("reads");
            return dropButton.then(transport.answerCallbackQuery(query.id(),
                    texts.get(ResponseKey.INVALID_MESSAGE_DATA, context.languageCode()), true));
        }

        return dropButton
                .then(transport.setMessageReaction(record.senderUserId(), record.messageId(), READ_REACTION)
                        .onErrorResume(e -> TransportException.isKind(e, TransportErrorKind.BAD_REQUEST), e -> {
                            log.debug("Read message no longer exists on @{}", context.botUsername());
                            return Mono.empty();
                        }))
                .then(Mono.fromRunnable(() -> tokens.discard(payload.prefix(), HashTable.READS)))
                .then(transport.answerCallbackQuery(query.id(),
                        texts.get(ResponseKey.MESSAGE_MARKED_READ, context.languageCode()), false));
    }

    private Mono<Void> removeReadButton(BotTransport transport, Message message, String data) {
        if (message == null || message.replyMarkup() == null) {
            return Mono.empty();
        }
        InlineKeyboard remaining = message.replyMarkup().without(data);
        return transport.editMessageReplyMarkup(message.chat().id(), message.messageId(),
                        remaining.isEmpty() ? null : remaining)
                .onErrorResume(e -> {
                    log.debug("Could not remove Read button: {}", e.getMessage());
                    return Mono.empty();
                });
    }
}
