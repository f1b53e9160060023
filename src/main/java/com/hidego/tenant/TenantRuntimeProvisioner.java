package com.hidego.tenant;

import com.hidego.routing.UpdateRoutes;
import reactor.core.publisher.Mono;

/**
 * Builds started runtimes. A failed provisioning leaves nothing behind and signals
 * {@link RuntimeCreationException}.
 */
public interface TenantRuntimeProvisioner {

    /** A tenant bot runtime with the tenant routes, subscribed to messages and callbacks. */
    Mono<TenantRuntime> provision(String credentialToken);

    /** The dispatcher bot runtime, subscribed to messages only. */
    Mono<TenantRuntime> provisionDispatcher(String credentialToken, UpdateRoutes routes);
}
