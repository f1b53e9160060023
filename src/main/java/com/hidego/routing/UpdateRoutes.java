package com.hidego.routing;

import com.hidego.transport.CallbackQuery;
import com.hidego.transport.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Route table of one bot. Commands go to their command handler, other messages
 * (and unknown commands) to the message handler, callbacks to the first handler
 * whose pattern matches the callback data.
 */
public final class UpdateRoutes {

    private static final Logger log = LoggerFactory.getLogger(UpdateRoutes.class);

    private final Map<String, UpdateHandler> commands;
    private final UpdateHandler messages;
    private final List<CallbackRoute> callbacks;

    private UpdateRoutes(Builder builder) {
        this.commands = Map.copyOf(builder.commands);
        this.messages = builder.messages;
        this.callbacks = List.copyOf(builder.callbacks);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the matching handler. Never signals an error: failures are logged here so
     * one update cannot end the runtime's processing loop.
     */
    public Mono<Void> dispatch(UpdateContext context) {
        return Mono.defer(() -> select(context)
                        .map(handler -> handler.handle(context))
                        .orElseGet(() -> {
                            log.debug("No route for update {} on @{}",
                                    context.update().updateId(), context.botUsername());
                            return Mono.empty();
                        }))
                .onErrorResume(e -> {
                    log.error("Update {} failed on @{}", context.update().updateId(), context.botUsername(), e);
                    return Mono.empty();
                });
    }

    private Optional<UpdateHandler> select(UpdateContext context) {
        Message message = context.message();
        if (message != null) {
            Optional<UpdateHandler> command = message.command().map(commands::get);
            if (command.isPresent()) {
                return command;
            }
            return Optional.ofNullable(messages);
        }
        CallbackQuery query = context.callbackQuery();
        if (query != null && query.data() != null) {
            return callbacks.stream()
                    .filter(route -> route.pattern().matcher(query.data()).matches())
                    .map(CallbackRoute::handler)
                    .findFirst();
        }
        return Optional.empty();
    }

    private record CallbackRoute(Pattern pattern, UpdateHandler handler) {}

    public static final class Builder {

        private final Map<String, UpdateHandler> commands = new HashMap<>();
        private final List<CallbackRoute> callbacks = new ArrayList<>();
        private UpdateHandler messages;

        private Builder() {}

        public Builder onCommand(String command, UpdateHandler handler) {
            commands.put(command, handler);
            return this;
        }

        public Builder onMessage(UpdateHandler handler) {
            this.messages = handler;
            return this;
        }

        public Builder onCallback(Pattern pattern, UpdateHandler handler) {
            callbacks.add(new CallbackRoute(pattern, handler));
            return this;
        }

        public UpdateRoutes build() {
            return new UpdateRoutes(this);
        }
    }
}
