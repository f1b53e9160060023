package com.hidego.store;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

/**
 * Server-held part of a correlation token: the ciphertext minus its last 30 characters,
 * keyed by its first 30 characters.
 */
@MappedSuperclass
public abstract class SplitHashRecord implements Persistable<String> {

    @Id
    @Column(name = "prefix_key", nullable = false, length = 64)
    private String prefixKey;

    @Column(name = "partial_hash", nullable = false, length = 512)
    private String partialHash;

    @Transient
    private boolean persisted;

    protected SplitHashRecord() {}

    protected SplitHashRecord(String prefixKey, String partialHash) {
        this.prefixKey = prefixKey;
        this.partialHash = partialHash;
    }

    @Override
    public String getId() { return prefixKey; }

    @Override
    public boolean isNew() { return !persisted; }

    @PostLoad
    @PostPersist
    void markPersisted() { this.persisted = true; }

    public String getPrefixKey() { return prefixKey; }
    public String getPartialHash() { return partialHash; }
}
