package com.hidego.store;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.io.Serializable;
import java.util.Objects;

/**
 * Presence means the user is blocked on that tenant bot. Both key columns hold
 * deterministic ciphertext.
 */
@Entity
@Table(name = "block_entries")
@IdClass(BlockEntry.Key.class)
public class BlockEntry implements Persistable<BlockEntry.Key> {

    @Id
    @Column(name = "blocked_user_id", nullable = false, length = 512)
    private String blockedUserId;

    @Id
    @Column(name = "bot_username", nullable = false, length = 512)
    private String botUsername;

    @Transient
    private boolean persisted;

    public BlockEntry() {}

    public BlockEntry(String blockedUserId, String botUsername) {
        this.blockedUserId = blockedUserId;
        this.botUsername = botUsername;
    }

    @Override
    public Key getId() { return new Key(blockedUserId, botUsername); }

    @Override
    public boolean isNew() { return !persisted; }

    @PostLoad
    @PostPersist
    void markPersisted() { this.persisted = true; }

    public String getBlockedUserId() { return blockedUserId; }
    public String getBotUsername() { return botUsername; }

    public static class Key implements Serializable {
        private String blockedUserId;
        private String botUsername;

        public Key() {}

        public Key(String blockedUserId, String botUsername) {
            this.blockedUserId = blockedUserId;
            this.botUsername = botUsername;
        }

        public String getBlockedUserId() { return blockedUserId; }
        public String getBotUsername() { return botUsername; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(blockedUserId, other.blockedUserId)
                    && Objects.equals(botUsername, other.botUsername);
        }

        @Override
        public int hashCode() {
            return Objects.hash(blockedUserId, botUsername);
        }
    }
}
