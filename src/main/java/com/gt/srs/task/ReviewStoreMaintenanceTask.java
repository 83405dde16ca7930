package com.gt.srs.task;

import com.gt.srs.review.ReviewStoreManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class ReviewStoreMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(ReviewStoreMaintenanceTask.class);

    private final ReviewStoreManager reviewStoreManager;
    private final Clock clock;
    private final int resetMarkerRetentionDays;
    private final int storeIdleMinutes;

    public ReviewStoreMaintenanceTask(ReviewStoreManager reviewStoreManager,
                                      Clock clock,
                                      @Value("${srs.maintenance.resetMarkerRetentionDays:7}") int resetMarkerRetentionDays,
                                      @Value("${srs.maintenance.storeIdleMinutes:60}") int storeIdleMinutes) {
        this.reviewStoreManager = reviewStoreManager;
        this.clock = clock;

        this.resetMarkerRetentionDays = resetMarkerRetentionDays;
        this.storeIdleMinutes = storeIdleMinutes;
    }

    @Scheduled(fixedDelayString = "${srs.maintenance.storeEvictionIntervalMs:300000}",
               initialDelayString = "${srs.maintenance.storeEvictionIntervalMs:300000}")
    public void releaseIdleStores() {
        Instant idleCutoff = clock.instant().minus(storeIdleMinutes, ChronoUnit.MINUTES);

        int storesReleased = reviewStoreManager.releaseIdleStores(idleCutoff);

        if (storesReleased > 0) {
            log.info("Released {} idle review store(s).", storesReleased);
        }
    }

    @Scheduled(cron = "@daily")
    public void performMaintenance() {
        purgeOldResetMarkers();
    }

    private void purgeOldResetMarkers() {
        Instant cutoff = clock.instant().minus(resetMarkerRetentionDays, ChronoUnit.DAYS);

        int markersPurged = reviewStoreManager.purgeResetMarkers(cutoff);

        log.info("Purged old reset markers. {} marker(s) removed.", markersPurged);
    }
}
