package com.hidego.tenant;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Username of the dispatcher bot, named in tenant bots' guide and profile texts.
 * Known once the dispatcher runtime is up.
 */
@Component
public class CreatorBotIdentity {

    private final AtomicReference<String> username = new AtomicReference<>();

    public void set(String botUsername) {
        username.set(botUsername);
    }

    public Optional<String> username() {
        return Optional.ofNullable(username.get());
    }
}
