package com.hidego.session;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide map of pending reply sessions. Every access, reads included, runs
 * under one lock so that check-then-act sequences compose.
 */
@Component
public class AdminReplySessionCache {

    private final Map<ReplySlot, AdminReplySession> sessions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public void set(AdminReplySession session) {
        lock.lock();
        try {
            sessions.put(session.getSlot(), session);
        } finally {
            lock.unlock();
        }
    }

    /** Stores {@code session} unless its slot is taken. Returns whether it was stored. */
    public boolean putIfAbsent(AdminReplySession session) {
        lock.lock();
        try {
            return sessions.putIfAbsent(session.getSlot(), session) == null;
        } finally {
            lock.unlock();
        }
    }

    public AdminReplySession get(ReplySlot slot) {
        lock.lock();
        try {
            return sessions.get(slot);
        } finally {
            lock.unlock();
        }
    }

    public AdminReplySession remove(ReplySlot slot) {
        lock.lock();
        try {
            return sessions.remove(slot);
        } finally {
            lock.unlock();
        }
    }

    /** Removes the slot only while it still holds this very session instance. */
    public boolean remove(ReplySlot slot, AdminReplySession session) {
        lock.lock();
        try {
            if (sessions.get(slot) != session) {
                return false;
            }
            sessions.remove(slot);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(ReplySlot slot) {
        lock.lock();
        try {
            return sessions.containsKey(slot);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }
}
