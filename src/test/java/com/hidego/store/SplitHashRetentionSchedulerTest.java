package com.hidego.store;

import com.hidego.config.HidegoProperties;
import com.hidego.support.InMemoryRelayStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SplitHashRetentionSchedulerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-15T04:00:00Z"), ZoneOffset.UTC);
    private final HidegoProperties properties = new HidegoProperties();
    private InMemoryRelayStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRelayStore();
        store.storeSplitHash("old", "a", HashTable.MESSAGES, "2025-11");
        store.storeSplitHash("edge", "b", HashTable.MESSAGES, "2026-01");
        store.storeSplitHash("new", "c", HashTable.MESSAGES, "2026-03");
    }

    @Test
    void zeroRetentionKeepsEverything() {
        new SplitHashRetentionScheduler(store, properties, clock).purgeExpiredMessageHashes();

        assertEquals(3, store.hashCount(HashTable.MESSAGES));
    }

    @Test
    void recordsOlderThanRetentionArePurged() {
        properties.getStore().setMessageRetentionMonths(2);

        new SplitHashRetentionScheduler(store, properties, clock).purgeExpiredMessageHashes();

        assertEquals(Set.of("edge", "new"), store.prefixes(HashTable.MESSAGES));
    }
}
