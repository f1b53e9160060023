package com.hidego.store;

import com.hidego.config.HidegoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;

/**
 * Purges admin-control records older than the configured number of months.
 * With a retention of 0 nothing is purged and Block/Answer buttons stay usable forever.
 */
@Component
public class SplitHashRetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SplitHashRetentionScheduler.class);

    private final RelayStore store;
    private final HidegoProperties properties;
    private final Clock clock;

    public SplitHashRetentionScheduler(RelayStore store, HidegoProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${hidego.store.purge-cron:0 0 4 * * *}")
    public void purgeExpiredMessageHashes() {
        int retentionMonths = properties.getStore().getMessageRetentionMonths();
        if (retentionMonths <= 0) {
            log.debug("Admin-control retention disabled, skipping purge");
            return;
        }
        String cutoff = YearMonth.now(clock).minusMonths(retentionMonths).toString();
        int deleted = store.purgeMessageHashesBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} admin-control records issued before {}", deleted, cutoff);
        }
    }
}
