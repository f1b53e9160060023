package com.hidego.routing;

import reactor.core.publisher.Mono;

@FunctionalInterface
public interface UpdateHandler {

    Mono<Void> handle(UpdateContext context);
}
