package com.gt.srs.summary;

import com.gt.srs.model.MaturityBand;
import com.gt.srs.model.ReviewRecord;
import com.gt.srs.model.ReviewStats;
import com.gt.srs.review.ReviewStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

@Component
public class StatsAggregator {

    private final ZoneId statsZone;

    @Autowired
    public StatsAggregator(@Value("${srs.stats.zoneId}") String statsZoneId) {
        this.statsZone = ZoneId.of(statsZoneId);
    }

    public ReviewStats stats(ReviewStore reviewStore, Instant now) {
        List<ReviewRecord> reviewRecords = reviewStore.records();
        LocalDate today = LocalDate.ofInstant(now, statsZone);

        int due = 0;
        int reviewedToday = 0;
        int learning = 0;
        int mature = 0;

        for (ReviewRecord reviewRecord : reviewRecords) {
            if (reviewRecord.isDue(now)) {
                due++;
            }
            if (reviewRecord.lastReviewedAt() != null && LocalDate.ofInstant(reviewRecord.lastReviewedAt(), statsZone).equals(today)) {
                reviewedToday++;
            }

            MaturityBand maturityBand = reviewRecord.maturityBand();
            if (maturityBand == MaturityBand.Learning) {
                learning++;
            } else if (maturityBand == MaturityBand.Mature) {
                mature++;
            }
        }

        return new ReviewStats(reviewRecords.size(), due, reviewedToday, learning, mature);
    }
}
