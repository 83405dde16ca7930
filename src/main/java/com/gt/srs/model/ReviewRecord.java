package com.gt.srs.model;

import java.time.Instant;

public record ReviewRecord(String itemId,
                           String ownerId,
                           Instant dueAt,
                           double easeFactor,
                           int intervalDays,
                           int repetitionCount,
                           Grade lastGrade,
                           Instant lastReviewedAt) {

    public boolean isDue(Instant now) {
        return dueAt != null && !dueAt.isAfter(now);
    }

    public MaturityBand maturityBand() {
        return MaturityBand.forInterval(intervalDays);
    }
}
