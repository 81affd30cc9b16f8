package com.venue.scout.recommender.jobs;

import com.venue.scout.recommender.service.store.RecommendationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves pending and viewed records past their lifetime to expired.
 * <p>
 * Configure (optional):
 * scout.jobs.expiry.cron=0 0/15 * * * *
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecommendationExpiryJob {

    private final RecommendationStore store;

    @Scheduled(cron = "${scout.jobs.expiry.cron:0 0/15 * * * *}")
    public void expireStale() {
        long t0 = System.currentTimeMillis();
        try {
            int expired = store.expireStale();
            log.info("expiry job: {} records expired ({} ms)", expired, System.currentTimeMillis() - t0);
        } catch (RuntimeException e) {
            log.warn("expiry job error: {}", e.getMessage(), e);
        }
    }
}
