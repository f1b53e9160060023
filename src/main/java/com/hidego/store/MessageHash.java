package com.hidego.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "message_hashes")
public class MessageHash extends SplitHashRecord {

    /** Year-month ({@code yyyy-MM}) the token was issued in. */
    @Column(name = "period_tag", length = 7)
    private String periodTag;

    public MessageHash() {}

    public MessageHash(String prefixKey, String partialHash, String periodTag) {
        super(prefixKey, partialHash);
        this.periodTag = periodTag;
    }

    public String getPeriodTag() { return periodTag; }
}
