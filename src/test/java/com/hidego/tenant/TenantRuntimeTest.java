package com.hidego.tenant;

import com.hidego.routing.UpdateRoutes;
import com.hidego.support.FakeBotTransport;
import com.hidego.transport.Chat;
import com.hidego.transport.Message;
import com.hidego.transport.Update;
import com.hidego.transport.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TenantRuntimeTest {

    private static final User BOT = new User(77L, true, "Alpha", null, "alpha_bot", null);
    private static final User USER = new User(1001L, false, "Ana", null, null, "en");

    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
    }

    private static Update update(long id) {
        return new Update(id, new Message(id, USER, new Chat(USER.id(), "private"), "hello"), null);
    }

    private TenantRuntime runtime(UpdateRoutes routes, int capacity, int concurrency) {
        return new TenantRuntime("77:token", FakeBotTransport.forBot(77L, "alpha_bot"), BOT, routes, capacity, concurrency);
    }

    @Test
    void submittedUpdatesAreDispatched() throws InterruptedException {
        CountDownLatch handled = new CountDownLatch(3);
        TenantRuntime runtime = runtime(UpdateRoutes.builder()
                .onMessage(ctx -> Mono.fromRunnable(handled::countDown))
                .build(), 8, 2);
        runtime.start();

        for (long i = 1; i <= 3; i++) {
            assertEquals(SubmitResult.ACCEPTED, runtime.submit(update(i)));
        }

        assertTrue(handled.await(5, TimeUnit.SECONDS));
        runtime.stop();
    }

    @Test
    void fullQueueReportsOverload() {
        TenantRuntime runtime = runtime(UpdateRoutes.builder()
                .onMessage(ctx -> Mono.fromRunnable(() -> awaitRelease()))
                .build(), 1, 1);
        runtime.start();

        List<SubmitResult> results = new ArrayList<>();
        for (long i = 1; i <= 5; i++) {
            results.add(runtime.submit(update(i)));
        }

        assertEquals(SubmitResult.ACCEPTED, results.get(0));
        assertTrue(results.contains(SubmitResult.OVERLOADED), results.toString());
        runtime.stop();
    }

    @Test
    void acceptedUpdateRefreshesLastActivity() throws InterruptedException {
        TenantRuntime runtime = runtime(UpdateRoutes.builder().build(), 4, 1);
        Instant created = runtime.getLastActivity();

        runtime.submit(update(1));
        assertEquals(created, runtime.getLastActivity());

        runtime.start();
        Thread.sleep(5);
        runtime.submit(update(2));

        assertTrue(runtime.getLastActivity().isAfter(created));
        runtime.stop();
    }

    @Test
    void stoppedRuntimeRefusesUpdates() {
        TenantRuntime runtime = runtime(UpdateRoutes.builder().build(), 4, 1);
        assertEquals(SubmitResult.STOPPED, runtime.submit(update(1)));

        runtime.start();
        assertTrue(runtime.isRunning());
        runtime.stop();

        assertEquals(TenantRuntime.State.STOPPED, runtime.getState());
        assertEquals(SubmitResult.STOPPED, runtime.submit(update(2)));
    }

    @Test
    void secondStopReportsNotRunning() {
        TenantRuntime runtime = runtime(UpdateRoutes.builder().build(), 4, 1);
        runtime.start();
        runtime.stop();

        IllegalStateException e = assertThrows(IllegalStateException.class, runtime::stop);
        assertEquals("not running", e.getMessage());
        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void releaseClosesTransport() {
        FakeBotTransport transport = FakeBotTransport.forBot(77L, "alpha_bot");
        TenantRuntime runtime = new TenantRuntime("77:token", transport, BOT, UpdateRoutes.builder().build(), 4, 1);

        runtime.release();

        assertTrue(transport.isClosed());
    }

    private void awaitRelease() {
        try {
            release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
