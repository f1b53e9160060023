package com.hidego.store;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "read_hashes")
public class ReadHash extends SplitHashRecord {

    public ReadHash() {}

    public ReadHash(String prefixKey, String partialHash) {
        super(prefixKey, partialHash);
    }
}
