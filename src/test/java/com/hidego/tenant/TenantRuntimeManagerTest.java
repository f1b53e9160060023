package com.hidego.tenant;

import com.hidego.config.HidegoProperties;
import com.hidego.crypto.Encryptor;
import com.hidego.crypto.MasterPassphrase;
import com.hidego.observability.RelayMetrics;
import com.hidego.routing.UpdateRoutes;
import com.hidego.store.RelayStore;
import com.hidego.support.FakeBotTransport;
import com.hidego.transport.BotTransportFactory;
import com.hidego.transport.TransportErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TenantRuntimeManagerTest {

    private static final Encryptor ENCRYPTOR =
            new Encryptor(new MasterPassphrase("correct horse battery".toCharArray()));

    @Mock private TenantRuntimeProvisioner provisioner;
    @Mock private RelayStore store;
    @Mock private BotTransportFactory transportFactory;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CreatorBotIdentity creatorIdentity = new CreatorBotIdentity();
    private TenantRuntimeManager manager;

    @BeforeEach
    void setUp() {
        HidegoProperties properties = new HidegoProperties();
        properties.getRuntime().setMaxLiveRuntimes(2);
        manager = new TenantRuntimeManager(provisioner, store, ENCRYPTOR, transportFactory,
                creatorIdentity, new RelayMetrics(registry), properties);
        when(provisioner.provision(anyString())).thenAnswer(inv -> {
            String token = inv.getArgument(0);
            return Mono.fromCallable(() -> runtime(token));
        });
    }

    private static TenantRuntime runtime(String token) {
        TenantRuntime runtime = mock(TenantRuntime.class);
        when(runtime.getCredentialToken()).thenReturn(token);
        when(runtime.getBotUsername()).thenReturn("bot_" + token.substring(0, 1));
        when(runtime.getTransport()).thenReturn(FakeBotTransport.forBot(1L, "bot_" + token.substring(0, 1)));
        return runtime;
    }

    @Test
    void liveRuntimeIsReused() {
        TenantRuntime first = manager.getOrCreateRuntime("1:a");
        TenantRuntime second = manager.getOrCreateRuntime("1:a");

        assertSame(first, second);
        verify(provisioner, times(1)).provision("1:a");
        assertTrue(manager.isLive("1:a"));
    }

    @Test
    void insertBeyondCapacityEvictsLeastRecentlyUsed() {
        TenantRuntime a = manager.getOrCreateRuntime("1:a");
        TenantRuntime b = manager.getOrCreateRuntime("2:b");
        manager.getOrCreateRuntime("1:a");
        manager.getOrCreateRuntime("3:c");

        assertEquals(2, manager.liveCount());
        assertTrue(manager.isLive("1:a"));
        assertFalse(manager.isLive("2:b"));
        assertTrue(manager.isLive("3:c"));

        verify(b, timeout(2000)).stop();
        verify(b, timeout(2000)).release();
        verify(a, never()).stop();
        assertEquals(1.0, registry.get("hidego.runtimes.evicted").counter().count());
        assertEquals(2.0, registry.get("hidego.runtimes.live").gauge().value());
    }

    @Test
    void concurrentRequestsProvisionOnce() throws Exception {
        AtomicInteger provisioned = new AtomicInteger();
        when(provisioner.provision("9:z")).thenAnswer(inv -> Mono.fromCallable(() -> {
            provisioned.incrementAndGet();
            Thread.sleep(100);
            return runtime("9:z");
        }));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TenantRuntime>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return manager.getOrCreateRuntime("9:z");
                }));
            }
            start.countDown();
            TenantRuntime expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<TenantRuntime> result : results) {
                assertSame(expected, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, provisioned.get());
    }

    @Test
    void failedCreationLeavesCacheUnchanged() {
        when(provisioner.provision("4:d"))
                .thenReturn(Mono.error(new RuntimeCreationException("Unauthorized", null)))
                .thenAnswer(inv -> Mono.fromCallable(() -> runtime("4:d")));

        RuntimeCreationException e = assertThrows(RuntimeCreationException.class,
                () -> manager.getOrCreateRuntime("4:d"));
        assertEquals("Unauthorized", e.getMessage());
        assertEquals(0, manager.liveCount());

        manager.getOrCreateRuntime("4:d");
        verify(provisioner, times(2)).provision("4:d");
    }

    @Test
    void unexpectedProvisioningErrorIsWrapped() {
        when(provisioner.provision("5:e")).thenReturn(Mono.error(new IllegalStateException("no base url")));

        assertThrows(RuntimeCreationException.class, () -> manager.getOrCreateRuntime("5:e"));
        assertFalse(manager.isLive("5:e"));
    }

    @Test
    void webhookForUnknownTokenIsRejected() {
        when(store.isRegisteredTenant("6:f")).thenReturn(false);

        assertThrows(UnknownTenantException.class, () -> manager.resolveForWebhook("6:f"));
        verify(provisioner, never()).provision(anyString());
    }

    @Test
    void webhookForRegisteredTenantProvisionsOnDemand() {
        when(store.isRegisteredTenant("7:g")).thenReturn(true);

        TenantRuntime runtime = manager.resolveForWebhook("7:g");

        assertSame(runtime, manager.resolveForWebhook("7:g"));
        verify(provisioner, times(1)).provision("7:g");
    }

    @Test
    void dispatcherIsPinnedOutsideCache() {
        TenantRuntime dispatcher = runtime("0:main");
        when(dispatcher.getBotUsername()).thenReturn("hidego_bot");
        when(provisioner.provisionDispatcher(eq("0:main"), any(UpdateRoutes.class))).thenReturn(Mono.just(dispatcher));

        manager.attachDispatcher("0:main", UpdateRoutes.builder().build());

        assertSame(dispatcher, manager.resolveForWebhook("0:main"));
        assertEquals("hidego_bot", creatorIdentity.username().orElseThrow());
        assertEquals(0, manager.liveCount());
        verify(store, never()).isRegisteredTenant("0:main");
    }

    @Test
    void revokeTearsDownAndDeletesRegistration() {
        TenantRuntime runtime = manager.getOrCreateRuntime("1:a");
        FakeBotTransport transport = (FakeBotTransport) runtime.getTransport();
        when(store.removeTenantRegistration(ENCRYPTOR.encryptDeterministic("1:a"))).thenReturn(true);

        assertTrue(manager.revoke("1:a").block());

        assertFalse(manager.isLive("1:a"));
        assertEquals(1, transport.deleteWebhookCalls());
        verify(runtime, timeout(1000)).stop();
        verify(runtime, timeout(1000)).release();
    }

    @Test
    void revokeOfIdleTenantUsesTransientTransport() {
        FakeBotTransport transport = FakeBotTransport.forBot(2L, "bot_b");
        transport.failNext("deleteWebhook", TransportErrorKind.UNAUTHORIZED);
        when(transportFactory.create("2:b")).thenReturn(transport);
        when(store.removeTenantRegistration(anyString())).thenReturn(true);

        assertTrue(manager.revoke("2:b").block());

        awaitTrue(transport::isClosed);
        verify(store).removeTenantRegistration(ENCRYPTOR.encryptDeterministic("2:b"));
    }

    @Test
    void revokeDuringProvisioningRemovesTheFreshRuntime() throws Exception {
        AtomicBoolean registered = new AtomicBoolean(true);
        when(store.isRegisteredTenant("5:e")).thenAnswer(inv -> registered.get());
        when(store.removeTenantRegistration(anyString())).thenAnswer(inv -> {
            registered.set(false);
            return true;
        });
        CountDownLatch provisioning = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        TenantRuntime fresh = runtime("5:e");
        when(provisioner.provision("5:e")).thenAnswer(inv -> Mono.fromCallable(() -> {
            provisioning.countDown();
            proceed.await(5, TimeUnit.SECONDS);
            return fresh;
        }));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<TenantRuntime> delivery = pool.submit(() -> manager.resolveForWebhook("5:e"));
            assertTrue(provisioning.await(5, TimeUnit.SECONDS));
            Future<Boolean> revoked = pool.submit(() -> manager.revoke("5:e").block());

            proceed.countDown();

            assertSame(fresh, delivery.get(5, TimeUnit.SECONDS));
            assertTrue(revoked.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertFalse(manager.isLive("5:e"));
        verify(fresh, timeout(1000)).stop();
        verify(fresh, timeout(1000)).release();
    }

    @Test
    void deliveryQueuedBehindRevokeIsRejected() {
        when(store.isRegisteredTenant("8:h")).thenReturn(true, false);

        assertThrows(UnknownTenantException.class, () -> manager.resolveForWebhook("8:h"));

        verify(provisioner, never()).provision("8:h");
        assertFalse(manager.isLive("8:h"));
    }

    @Test
    void creationLocksAreDroppedAfterUse() {
        when(provisioner.provision(startsWith("99"))).thenReturn(
                Mono.error(new RuntimeCreationException("Unauthorized", null)));

        for (int i = 0; i < 50; i++) {
            String token = "99" + i + ":bogus";
            assertThrows(RuntimeCreationException.class, () -> manager.getOrCreateRuntime(token));
        }
        manager.getOrCreateRuntime("1:a");
        when(store.removeTenantRegistration(anyString())).thenReturn(true);
        manager.revoke("1:a").block();

        assertEquals(0, manager.pendingCreationLocks());
        assertEquals(0, manager.liveCount());
    }

    @Test
    void shutdownStopsEveryRuntime() {
        TenantRuntime a = manager.getOrCreateRuntime("1:a");
        TenantRuntime b = manager.getOrCreateRuntime("2:b");
        doThrow(new IllegalStateException("not running")).when(a).stop();

        manager.shutdown();

        verify(a).release();
        verify(b).stop();
        verify(b).release();
        assertEquals(0, manager.liveCount());
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 2s");
            }
            Thread.onSpinWait();
        }
    }
}
