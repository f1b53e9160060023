package com.hidego.transport;

@FunctionalInterface
public interface BotTransportFactory {

    BotTransport create(String credentialToken);
}
