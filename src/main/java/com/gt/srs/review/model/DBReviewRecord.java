package com.gt.srs.review.model;

import com.gt.srs.model.Grade;
import com.gt.srs.model.ReviewRecord;

import java.time.Instant;

public record DBReviewRecord(String ownerId,
                             String itemId,
                             Instant dueAt,
                             double easeFactor,
                             int intervalDays,
                             int repetitionCount,
                             Grade lastGrade,
                             Instant lastReviewedAt,
                             Instant updateInstant) {

    public ReviewRecord toReviewRecord() {
        return new ReviewRecord(itemId, ownerId, dueAt, easeFactor, intervalDays, repetitionCount, lastGrade, lastReviewedAt);
    }
}
