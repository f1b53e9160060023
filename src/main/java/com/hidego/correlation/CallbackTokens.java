package com.hidego.correlation;

import com.hidego.store.HashTable;
import com.hidego.store.RelayStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;

/**
 * Issues and resolves button tokens: the {@link Correlator} does the cryptography,
 * the {@link RelayStore} keeps the server half.
 */
@Service
public class CallbackTokens {

    private static final Logger log = LoggerFactory.getLogger(CallbackTokens.class);

    private final Correlator correlator;
    private final RelayStore store;
    private final Clock clock;

    public CallbackTokens(Correlator correlator, RelayStore store, Clock clock) {
        this.correlator = correlator;
        this.store = store;
        this.clock = clock;
    }

    public SplitToken issueAdminControl(AdminControlRecord record) {
        SplitToken token = correlator.mint(record);
        persist(token, HashTable.MESSAGES, YearMonth.now(clock).toString());
        return token;
    }

    public SplitToken issueReadReceipt(ReadReceiptRecord record) {
        SplitToken token = correlator.mint(record);
        persist(token, HashTable.READS, null);
        return token;
    }

    public AdminControlRecord resolveAdminControl(CallbackPayload payload) {
        return correlator.openAdminControl(lookup(payload, HashTable.MESSAGES));
    }

    public ReadReceiptRecord resolveReadReceipt(CallbackPayload payload) {
        return correlator.openReadReceipt(lookup(payload, HashTable.READS));
    }

    /** Removes the server half of a token; later payloads for it no longer resolve. */
    public boolean discard(String prefix, HashTable table) {
        return store.removePartialHash(prefix, table);
    }

    private void persist(SplitToken token, HashTable table, String periodTag) {
        if (!store.storeSplitHash(token.prefix(), token.storedPortion(), table, periodTag)) {
            throw new IllegalStateException("Could not persist " + token + " in " + table);
        }
    }

    private String lookup(CallbackPayload payload, HashTable table) {
        return store.getFullHashByPrefix(payload.prefix(), payload.suffix(), table)
                .orElseThrow(() -> {
                    log.warn("No stored token half for {} callback in {}", payload.operation(), table);
                    return new InvalidMessageDataException("Unknown token prefix");
                });
    }
}
