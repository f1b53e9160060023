package com.hidego.store;

/**
 * The two split-hash tables: admin-control tokens and read-receipt tokens.
 */
public enum HashTable {
    MESSAGES,
    READS
}
