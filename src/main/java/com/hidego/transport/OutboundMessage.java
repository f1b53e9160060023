package com.hidego.transport;

/**
 * A text message to send, built fluently: {@code OutboundMessage.text(chat, "hi").html().replyingTo(id)}.
 */
public record OutboundMessage(
        long chatId,
        String text,
        String parseMode,
        Long replyToMessageId,
        InlineKeyboard keyboard,
        boolean disableNotification,
        boolean disableWebPagePreview
) {
    public static final String HTML = "HTML";

    public static OutboundMessage text(long chatId, String text) {
        return new OutboundMessage(chatId, text, null, null, null, false, false);
    }

    public OutboundMessage html() {
        return new OutboundMessage(chatId, text, HTML, replyToMessageId, keyboard,
                disableNotification, disableWebPagePreview);
    }

    public OutboundMessage replyingTo(Long messageId) {
        return new OutboundMessage(chatId, text, parseMode, messageId, keyboard,
                disableNotification, disableWebPagePreview);
    }

    public OutboundMessage withKeyboard(InlineKeyboard markup) {
        return new OutboundMessage(chatId, text, parseMode, replyToMessageId, markup,
                disableNotification, disableWebPagePreview);
    }

    public OutboundMessage silent() {
        return new OutboundMessage(chatId, text, parseMode, replyToMessageId, keyboard,
                true, disableWebPagePreview);
    }

    public OutboundMessage noPreview() {
        return new OutboundMessage(chatId, text, parseMode, replyToMessageId, keyboard,
                disableNotification, true);
    }
}
