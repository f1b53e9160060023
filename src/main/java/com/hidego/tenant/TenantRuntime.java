package com.hidego.tenant;

import com.hidego.routing.UpdateContext;
import com.hidego.routing.UpdateRoutes;
import com.hidego.transport.BotTokens;
import com.hidego.transport.BotTransport;
import com.hidego.transport.Update;
import com.hidego.transport.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live message-processing instance of one tenant bot: a bounded inbound queue
 * drained by up to {@code concurrency} route dispatches at a time.
 */
public class TenantRuntime {

    private static final Logger log = LoggerFactory.getLogger(TenantRuntime.class);

    public enum State { NEW, RUNNING, STOPPED }

    private final String credentialToken;
    private final BotTransport transport;
    private final User identity;
    private final UpdateRoutes routes;
    private final int concurrency;
    private final Sinks.Many<Update> inbound;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private volatile Disposable processing;
    private volatile Instant lastActivity = Instant.now();

    public TenantRuntime(String credentialToken, BotTransport transport, User identity,
                         UpdateRoutes routes, int queueCapacity, int concurrency) {
        this.credentialToken = credentialToken;
        this.transport = transport;
        this.identity = identity;
        this.routes = routes;
        this.concurrency = concurrency;
        this.inbound = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(queueCapacity));
    }

    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("already started");
        }
        processing = inbound.asFlux()
                .flatMap(update -> routes.dispatch(new UpdateContext(update, transport, identity))
                        .subscribeOn(Schedulers.boundedElastic()), concurrency)
                .subscribe(
                        ignored -> {},
                        e -> log.error("Processing loop of @{} ended with an error", identity.username(), e));
        log.info("Runtime for @{} running", identity.username());
    }

    /** Queues an update; never blocks. Emission is serialized across webhook threads. */
    public synchronized SubmitResult submit(Update update) {
        if (state.get() != State.RUNNING) {
            return SubmitResult.STOPPED;
        }
        lastActivity = Instant.now();
        Sinks.EmitResult result = inbound.tryEmitNext(update);
        if (result.isSuccess()) {
            return SubmitResult.ACCEPTED;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.warn("Inbound queue of @{} is full, rejecting update {}", identity.username(), update.updateId());
            return SubmitResult.OVERLOADED;
        }
        log.debug("Update {} not queued on @{}: {}", update.updateId(), identity.username(), result);
        return SubmitResult.STOPPED;
    }

    /**
     * Stops the processing loop; queued updates are dropped.
     *
     * @throws IllegalStateException with message {@code "not running"} unless running
     */
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            throw new IllegalStateException("not running");
        }
        synchronized (this) {
            inbound.tryEmitComplete();
        }
        Disposable loop = processing;
        if (loop != null) {
            loop.dispose();
        }
    }

    /** Releases the transport. Safe to call in any state. */
    public void release() {
        transport.close();
    }

    public String getCredentialToken() { return credentialToken; }
    public BotTransport getTransport() { return transport; }
    public User getIdentity() { return identity; }
    public String getBotUsername() { return identity.username(); }
    public State getState() { return state.get(); }
    public boolean isRunning() { return state.get() == State.RUNNING; }
    public Instant getLastActivity() { return lastActivity; }

    @Override
    public String toString() {
        return "TenantRuntime[@" + identity.username() + ", " + BotTokens.shorten(credentialToken)
                + ", " + state.get() + "]";
    }
}
