package com.hidego.tenant;

import com.hidego.config.HidegoProperties;
import com.hidego.crypto.Encryptor;
import com.hidego.observability.RelayMetrics;
import com.hidego.routing.UpdateRoutes;
import com.hidego.store.RelayStore;
import com.hidego.transport.BotTokens;
import com.hidego.transport.BotTransport;
import com.hidego.transport.BotTransportFactory;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded cache of live tenant runtimes.
 * <p>
 * Creation is serialized per credential token with double-checked locking, so a
 * burst of deliveries for one new tenant provisions it once while other tenants
 * proceed. The cache itself is an access-ordered map whose short critical sections
 * never span a remote call. Inserting beyond capacity evicts the least recently
 * used runtime; its teardown runs in the background and only logs failures.
 * <p>
 * The dispatcher runtime is pinned outside the cache.
 */
@Service
public class TenantRuntimeManager {

    private static final Logger log = LoggerFactory.getLogger(TenantRuntimeManager.class);

    private final TenantRuntimeProvisioner provisioner;
    private final RelayStore store;
    private final Encryptor encryptor;
    private final BotTransportFactory transportFactory;
    private final CreatorBotIdentity creatorIdentity;
    private final RelayMetrics metrics;
    private final int capacity;
    private final Duration creationTimeout;

    private final LinkedHashMap<String, TenantRuntime> live = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock cacheLock = new ReentrantLock();
    private final ConcurrentHashMap<String, CreationLock> creationLocks = new ConcurrentHashMap<>();
    private volatile TenantRuntime dispatcher;

    public TenantRuntimeManager(TenantRuntimeProvisioner provisioner,
                                RelayStore store,
                                Encryptor encryptor,
                                BotTransportFactory transportFactory,
                                CreatorBotIdentity creatorIdentity,
                                RelayMetrics metrics,
                                HidegoProperties properties) {
        this.provisioner = provisioner;
        this.store = store;
        this.encryptor = encryptor;
        this.transportFactory = transportFactory;
        this.creatorIdentity = creatorIdentity;
        this.metrics = metrics;
        this.capacity = properties.getRuntime().getMaxLiveRuntimes();
        this.creationTimeout = properties.getRuntime().getCreationTimeout();
    }

    /**
     * Returns the live runtime for {@code credentialToken}, provisioning it first when absent.
     * Blocks the caller for at most the configured creation timeout.
     *
     * @throws RuntimeCreationException when provisioning fails; the cache is left unchanged
     */
    public TenantRuntime getOrCreateRuntime(String credentialToken) {
        return getOrCreate(credentialToken, false);
    }

    /**
     * Runtime for an inbound delivery: the dispatcher, a live tenant, or a registered
     * tenant provisioned on demand.
     *
     * @throws UnknownTenantException when the token is none of these
     */
    public TenantRuntime resolveForWebhook(String credentialToken) {
        TenantRuntime pinned = dispatcher;
        if (pinned != null && pinned.getCredentialToken().equals(credentialToken)) {
            return pinned;
        }
        TenantRuntime existing = lookup(credentialToken);
        if (existing != null) {
            return existing;
        }
        if (!store.isRegisteredTenant(credentialToken)) {
            throw new UnknownTenantException(BotTokens.shorten(credentialToken));
        }
        return getOrCreate(credentialToken, true);
    }

    private TenantRuntime getOrCreate(String credentialToken, boolean requireRegistration) {
        TenantRuntime existing = lookup(credentialToken);
        if (existing != null) {
            return existing;
        }

        CreationLock lock = acquireCreationLock(credentialToken);
        try {
            existing = lookup(credentialToken);
            if (existing != null) {
                return existing;
            }
            // revoked while this delivery waited for the lock
            if (requireRegistration && !store.isRegisteredTenant(credentialToken)) {
                throw new UnknownTenantException(BotTokens.shorten(credentialToken));
            }
            TenantRuntime created = provision(credentialToken);
            insert(credentialToken, created);
            log.info("Runtime created for @{} ({} live)", created.getBotUsername(), liveCount());
            return created;
        } finally {
            releaseCreationLock(credentialToken, lock);
        }
    }

    public boolean isLive(String credentialToken) {
        cacheLock.lock();
        try {
            return live.containsKey(credentialToken);
        } finally {
            cacheLock.unlock();
        }
    }

    public int liveCount() {
        cacheLock.lock();
        try {
            return live.size();
        } finally {
            cacheLock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Takes a tenant down for good: removes its runtime, deletes the platform webhook,
     * deletes its registration and tears the runtime down. Emits whether a
     * registration was removed.
     */
    public Mono<Boolean> revoke(String credentialToken) {
        return Mono.fromCallable(() -> detach(credentialToken))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(detached -> {
                    TenantRuntime removed = detached.runtime();
                    BotTransport transport = removed != null
                            ? removed.getTransport()
                            : transportFactory.create(credentialToken);
                    return transport.deleteWebhook()
                            .onErrorResume(e -> {
                                log.warn("Could not delete webhook of {}: {}",
                                        BotTokens.shorten(credentialToken), e.getMessage());
                                return Mono.empty();
                            })
                            .thenReturn(detached.registrationRemoved())
                            .doOnNext(deleted -> log.info("Revoked {} (registration removed: {})",
                                    BotTokens.shorten(credentialToken), deleted))
                            .doFinally(signal -> {
                                if (removed != null) {
                                    teardown(removed);
                                } else {
                                    transport.close();
                                }
                            });
                });
    }

    /**
     * Drops the live runtime and the registration while holding the token's creation
     * lock, so a provisioning already in flight either finishes first and is removed
     * here, or runs afterwards and finds no registration.
     */
    private Detached detach(String credentialToken) {
        CreationLock lock = acquireCreationLock(credentialToken);
        try {
            TenantRuntime removed;
            cacheLock.lock();
            try {
                removed = live.remove(credentialToken);
                metrics.setLiveRuntimes(live.size());
            } finally {
                cacheLock.unlock();
            }
            boolean deleted = store.removeTenantRegistration(encryptor.encryptDeterministic(credentialToken));
            return new Detached(removed, deleted);
        } finally {
            releaseCreationLock(credentialToken, lock);
        }
    }

    /** Provisions and pins the dispatcher bot runtime. */
    public TenantRuntime attachDispatcher(String credentialToken, UpdateRoutes routes) {
        TenantRuntime created = provisioner.provisionDispatcher(credentialToken, routes).block(creationTimeout);
        if (created == null) {
            throw new RuntimeCreationException("Dispatcher provisioning completed without a runtime", null);
        }
        TenantRuntime previous = dispatcher;
        dispatcher = created;
        creatorIdentity.set(created.getBotUsername());
        if (previous != null) {
            teardown(previous);
        }
        log.info("Dispatcher @{} attached", created.getBotUsername());
        return created;
    }

    public TenantRuntime getDispatcher() {
        return dispatcher;
    }

    @PreDestroy
    public void shutdown() {
        List<TenantRuntime> all;
        cacheLock.lock();
        try {
            all = new ArrayList<>(live.values());
            live.clear();
            metrics.setLiveRuntimes(0);
        } finally {
            cacheLock.unlock();
        }
        TenantRuntime pinned = dispatcher;
        dispatcher = null;
        if (pinned != null) {
            all.add(pinned);
        }
        log.info("Shutting down {} runtimes", all.size());
        for (TenantRuntime runtime : all) {
            teardown(runtime);
        }
    }

    /** Number of tokens with a creation or revocation in progress. */
    int pendingCreationLocks() {
        return creationLocks.size();
    }

    private CreationLock acquireCreationLock(String credentialToken) {
        CreationLock holder = creationLocks.compute(credentialToken, (token, existing) -> {
            CreationLock h = existing != null ? existing : new CreationLock();
            h.users++;
            return h;
        });
        holder.lock.lock();
        return holder;
    }

    private void releaseCreationLock(String credentialToken, CreationLock holder) {
        holder.lock.unlock();
        creationLocks.computeIfPresent(credentialToken, (token, h) -> --h.users == 0 ? null : h);
    }

    private TenantRuntime lookup(String credentialToken) {
        cacheLock.lock();
        try {
            return live.get(credentialToken);
        } finally {
            cacheLock.unlock();
        }
    }

    private TenantRuntime provision(String credentialToken) {
        Timer.Sample sample = metrics.startCreationTimer();
        TenantRuntime created;
        try {
            created = provisioner.provision(credentialToken).block(creationTimeout);
        } catch (RuntimeCreationException e) {
            log.warn("Runtime creation failed for {}: {}", BotTokens.shorten(credentialToken), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Runtime creation failed for {}: {}", BotTokens.shorten(credentialToken), e.getMessage());
            throw new RuntimeCreationException(e.getMessage(), e);
        }
        if (created == null) {
            throw new RuntimeCreationException("Provisioning completed without a runtime", null);
        }
        metrics.runtimeCreated(sample);
        return created;
    }

    private void insert(String credentialToken, TenantRuntime runtime) {
        TenantRuntime evicted = null;
        cacheLock.lock();
        try {
            live.put(credentialToken, runtime);
            if (live.size() > capacity) {
                Iterator<Map.Entry<String, TenantRuntime>> eldest = live.entrySet().iterator();
                evicted = eldest.next().getValue();
                eldest.remove();
            }
            metrics.setLiveRuntimes(live.size());
        } finally {
            cacheLock.unlock();
        }
        if (evicted != null) {
            metrics.runtimeEvicted();
            log.info("Evicting least recently used runtime @{}", evicted.getBotUsername());
            TenantRuntime toStop = evicted;
            Schedulers.boundedElastic().schedule(() -> teardown(toStop));
        }
    }

    private void teardown(TenantRuntime runtime) {
        try {
            runtime.stop();
        } catch (IllegalStateException e) {
            log.info("Runtime @{} {}", runtime.getBotUsername(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Stopping runtime @{} failed: {}", runtime.getBotUsername(), e.getMessage());
        }
        try {
            runtime.release();
        } catch (RuntimeException e) {
            log.warn("Releasing transport of @{} failed: {}", runtime.getBotUsername(), e.getMessage());
        }
    }

    /** Per-token lock, dropped from the map once its last user releases it. Counted inside {@code compute}. */
    private static final class CreationLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    private record Detached(TenantRuntime runtime, boolean registrationRemoved) {
    }
}
