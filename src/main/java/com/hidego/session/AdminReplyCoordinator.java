package com.hidego.session;

import com.hidego.config.HidegoProperties;
import com.hidego.observability.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Lifecycle of admin reply sessions: IDLE to AWAITING_REPLY on Answer, and back on
 * a sent reply, an explicit cancel or the timeout. Whichever terminal path removes
 * the session from the cache first wins; the others become no-ops.
 */
@Service
public class AdminReplyCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AdminReplyCoordinator.class);

    private final AdminReplySessionCache cache;
    private final RelayMetrics metrics;
    private final Duration timeout;
    private final Scheduler scheduler;

    @Autowired
    public AdminReplyCoordinator(AdminReplySessionCache cache, RelayMetrics metrics,
                                 HidegoProperties properties) {
        this(cache, metrics, properties.getReply().getTimeout(), Schedulers.parallel());
    }

    public AdminReplyCoordinator(AdminReplySessionCache cache, RelayMetrics metrics,
                                 Duration timeout, Scheduler scheduler) {
        this.cache = cache;
        this.metrics = metrics;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    /** Opens a session. False, with the existing session untouched, when a reply is ongoing. */
    public boolean begin(AdminReplySession session) {
        if (!cache.putIfAbsent(session)) {
            log.debug("Reply already ongoing on bot {}", session.getSlot().botUsername());
            return false;
        }
        metrics.replySessionOpened();
        return true;
    }

    /**
     * Starts the session's timer. When it fires and the session is still current,
     * the session is closed and {@code onTimeout} runs; its errors are logged.
     */
    public void armTimeout(AdminReplySession session, Supplier<Mono<Void>> onTimeout) {
        session.setTimeout(Mono.delay(timeout, scheduler)
                .flatMap(tick -> {
                    if (!cache.remove(session.getSlot(), session)) {
                        return Mono.<Void>empty();
                    }
                    metrics.replySessionClosed();
                    log.info("Reply session timed out on bot {}", session.getSlot().botUsername());
                    return onTimeout.get();
                })
                .subscribe(
                        ignored -> {},
                        e -> log.warn("Reply timeout handling failed on bot {}: {}",
                                session.getSlot().botUsername(), e.getMessage())));
    }

    /** Closes {@code session} after a sent reply or a hard failure. True only for the first closer. */
    public boolean finish(AdminReplySession session) {
        if (!cache.remove(session.getSlot(), session)) {
            return false;
        }
        session.cancelTimeout();
        metrics.replySessionClosed();
        return true;
    }

    /** Cancels whatever session holds the slot; returns it, or null when idle. */
    public AdminReplySession cancel(ReplySlot slot) {
        AdminReplySession removed = cache.remove(slot);
        if (removed != null) {
            removed.cancelTimeout();
            metrics.replySessionClosed();
        }
        return removed;
    }

    public AdminReplySession active(ReplySlot slot) {
        return cache.get(slot);
    }

    public Duration getTimeout() {
        return timeout;
    }
}
