package com.hidego.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminReplySessionCacheTest {

    private final AdminReplySessionCache cache = new AdminReplySessionCache();
    private final ReplySlot slot = new ReplySlot(42L, "alpha_bot");

    private AdminReplySession session(long target) {
        return new AdminReplySession(slot, target, 7L, 42L, 9L, "en");
    }

    @Test
    void putIfAbsentKeepsFirstSession() {
        AdminReplySession first = session(1001L);
        assertTrue(cache.putIfAbsent(first));
        assertFalse(cache.putIfAbsent(session(1002L)));
        assertSame(first, cache.get(slot));
    }

    @Test
    void slotsAreIndependentPerBot() {
        cache.set(session(1001L));
        ReplySlot other = new ReplySlot(42L, "beta_bot");

        assertTrue(cache.exists(slot));
        assertFalse(cache.exists(other));
        assertTrue(cache.putIfAbsent(new AdminReplySession(other, 1003L, 8L, 42L, 10L, "fa")));
        assertEquals(2, cache.size());
    }

    @Test
    void conditionalRemoveMatchesIdentity() {
        AdminReplySession stale = session(1001L);
        cache.set(stale);
        cache.remove(slot);
        AdminReplySession current = session(1002L);
        cache.set(current);

        assertFalse(cache.remove(slot, stale));
        assertSame(current, cache.get(slot));
        assertTrue(cache.remove(slot, current));
        assertNull(cache.get(slot));
    }

    @Test
    void removeOfIdleSlotReturnsNull() {
        assertNull(cache.remove(slot));
        assertFalse(cache.exists(slot));
    }
}
