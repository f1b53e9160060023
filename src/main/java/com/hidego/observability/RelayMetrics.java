package com.hidego.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized Micrometer metrics for the relay. Tags never carry tokens or user ids.
 */
@Component
public class RelayMetrics {

    private final MeterRegistry registry;
    private final AtomicLong liveRuntimes = new AtomicLong(0);
    private final AtomicLong activeReplySessions = new AtomicLong(0);

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("hidego.runtimes.live", liveRuntimes);
        registry.gauge("hidego.reply.sessions.active", activeReplySessions);
    }

    // --- Webhook metrics ---

    public void recordWebhookUpdate(String outcome) {
        Counter.builder("hidego.webhook.updates")
                .tag("outcome", outcome)
                .register(registry).increment();
    }

    // --- Runtime metrics ---

    public Timer.Sample startCreationTimer() {
        return Timer.start(registry);
    }

    public void runtimeCreated(Timer.Sample sample) {
        sample.stop(Timer.builder("hidego.runtimes.creation").register(registry));
        Counter.builder("hidego.runtimes.created").register(registry).increment();
    }

    public void runtimeEvicted() {
        Counter.builder("hidego.runtimes.evicted").register(registry).increment();
    }

    public void setLiveRuntimes(long count) {
        liveRuntimes.set(count);
    }

    // --- Relay metrics ---

    public void recordDispatch(String choice) {
        Counter.builder("hidego.relay.dispatched")
                .tag("choice", choice)
                .register(registry).increment();
    }

    public void recordReply(String outcome) {
        Counter.builder("hidego.relay.replies")
                .tag("outcome", outcome)
                .register(registry).increment();
    }

    public void recordInvalidToken(String table) {
        Counter.builder("hidego.tokens.invalid")
                .tag("table", table)
                .register(registry).increment();
    }

    // --- Reply session metrics ---

    public void replySessionOpened() {
        activeReplySessions.incrementAndGet();
    }

    public void replySessionClosed() {
        activeReplySessions.decrementAndGet();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
