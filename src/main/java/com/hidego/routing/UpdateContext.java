package com.hidego.routing;

import com.hidego.transport.BotTransport;
import com.hidego.transport.CallbackQuery;
import com.hidego.transport.Message;
import com.hidego.transport.Update;
import com.hidego.transport.User;

/**
 * One inbound update together with the bot that received it.
 */
public record UpdateContext(Update update, BotTransport transport, User bot) {

    public String botUsername() {
        return bot.username();
    }

    public Message message() {
        return update.message();
    }

    public CallbackQuery callbackQuery() {
        return update.callbackQuery();
    }

    public User sender() {
        return update.sender();
    }

    public String languageCode() {
        User sender = sender();
        return sender != null ? sender.languageCode() : null;
    }
}
