package com.hidego.tenant;

import com.hidego.config.HidegoProperties;
import com.hidego.config.SecretsConfig;
import com.hidego.routing.UpdateRoutes;
import com.hidego.transport.BotTokens;
import com.hidego.transport.BotTransport;
import com.hidego.transport.BotTransportFactory;
import com.hidego.transport.TransportException;
import com.hidego.transport.User;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Provisions runtimes bound to this process's webhook endpoint. The bot identity is
 * fetched with retries on transient errors; the webhook is rebound (and the bot
 * profile published) only when the platform points elsewhere.
 */
@Component
public class WebhookRuntimeProvisioner implements TenantRuntimeProvisioner {

    private static final Logger log = LoggerFactory.getLogger(WebhookRuntimeProvisioner.class);

    static final List<String> TENANT_UPDATES = List.of("message", "callback_query");
    static final List<String> DISPATCHER_UPDATES = List.of("message");
    private static final int IDENTITY_RETRIES = 2;
    private static final Duration IDENTITY_BACKOFF = Duration.ofSeconds(1);

    private final BotTransportFactory transportFactory;
    private final UpdateRoutes tenantRoutes;
    private final BotProfileConfigurer profileConfigurer;
    private final CreatorBotIdentity creatorIdentity;
    private final HidegoProperties properties;
    private final SecretsConfig secrets;

    public WebhookRuntimeProvisioner(BotTransportFactory transportFactory,
                                     @Qualifier("tenantRoutes") UpdateRoutes tenantRoutes,
                                     BotProfileConfigurer profileConfigurer,
                                     CreatorBotIdentity creatorIdentity,
                                     HidegoProperties properties,
                                     SecretsConfig secrets) {
        this.transportFactory = transportFactory;
        this.tenantRoutes = tenantRoutes;
        this.profileConfigurer = profileConfigurer;
        this.creatorIdentity = creatorIdentity;
        this.properties = properties;
        this.secrets = secrets;
    }

    @Override
    @Observed(name = "hidego.runtime.provision", contextualName = "runtime-provision")
    public Mono<TenantRuntime> provision(String credentialToken) {
        return build(credentialToken, tenantRoutes, TENANT_UPDATES,
                transport -> profileConfigurer.configureTenant(transport, creatorIdentity.username().orElse(null)));
    }

    @Override
    public Mono<TenantRuntime> provisionDispatcher(String credentialToken, UpdateRoutes routes) {
        return build(credentialToken, routes, DISPATCHER_UPDATES,
                transport -> properties.getDispatcher().isConfigureProfile()
                        ? profileConfigurer.configureDispatcher(transport)
                        : Mono.empty());
    }

    private Mono<TenantRuntime> build(String credentialToken, UpdateRoutes routes, List<String> allowedUpdates,
                                      Function<BotTransport, Mono<Void>> profile) {
        return Mono.defer(() -> {
            BotTransport transport = transportFactory.create(credentialToken);
            HidegoProperties.RuntimeProperties runtime = properties.getRuntime();
            return transport.getMe()
                    .retryWhen(Retry.backoff(IDENTITY_RETRIES, IDENTITY_BACKOFF)
                            .filter(WebhookRuntimeProvisioner::isTransient)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .flatMap(identity -> bindWebhook(transport, credentialToken, allowedUpdates)
                            .flatMap(rebound -> rebound
                                    ? profile.apply(transport)
                                            .onErrorResume(e -> {
                                                log.warn("Profile setup of @{} failed: {}", identity.username(), e.getMessage());
                                                return Mono.empty();
                                            })
                                            .thenReturn(identity)
                                    : Mono.just(identity)))
                    .map(identity -> start(credentialToken, transport, identity, routes, runtime))
                    .doOnCancel(transport::close)
                    .onErrorMap(e -> {
                        transport.close();
                        return e instanceof RuntimeCreationException ? e
                                : new RuntimeCreationException(e.getMessage(), e);
                    });
        });
    }

    /** Emits true when the webhook had to be (re)bound. */
    private Mono<Boolean> bindWebhook(BotTransport transport, String credentialToken, List<String> allowedUpdates) {
        String url = webhookUrl(credentialToken);
        return transport.getWebhookInfo()
                .flatMap(info -> {
                    if (url.equals(info.url())) {
                        return Mono.just(false);
                    }
                    log.info("Binding webhook of {} to this relay", BotTokens.shorten(credentialToken));
                    return transport.deleteWebhook()
                            .then(transport.setWebhook(url, secretToken(), allowedUpdates))
                            .thenReturn(true);
                });
    }

    private TenantRuntime start(String credentialToken, BotTransport transport, User identity,
                                UpdateRoutes routes, HidegoProperties.RuntimeProperties runtime) {
        TenantRuntime created = new TenantRuntime(credentialToken, transport, identity, routes,
                runtime.getQueueCapacity(), runtime.getUpdateConcurrency());
        created.start();
        return created;
    }

    String webhookUrl(String credentialToken) {
        String base = properties.getWebhook().getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new IllegalStateException("hidego.webhook.base-url is not configured");
        }
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/webhook/" + credentialToken;
    }

    private String secretToken() {
        String secret = secrets.getWebhookSecretToken();
        return secret == null || secret.isBlank() ? null : secret;
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof TransportException te && te.kind().isTransient();
    }
}
