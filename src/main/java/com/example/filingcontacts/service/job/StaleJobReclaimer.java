package com.example.filingcontacts.service.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fails runs orphaned by a previous crash or restart once the application is up.
 */
@Component
public class StaleJobReclaimer {

    private static final Logger logger = LoggerFactory.getLogger(StaleJobReclaimer.class);

    private final JobRunTracker tracker;

    public StaleJobReclaimer(JobRunTracker tracker) {
        this.tracker = tracker;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int reclaimed = tracker.reclaimStale();
        if (reclaimed > 0) {
            logger.warn("⚠️ Marked {} stale job runs as failed", reclaimed);
        } else {
            logger.info("✅ No stale job runs found");
        }
    }
}
