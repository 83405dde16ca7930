package com.gt.srs.util;

import com.gt.srs.model.Grade;
import com.gt.srs.model.ReviewRecord;
import com.gt.srs.scheduling.SchedulingEngine;

import java.time.Duration;
import java.time.Instant;

public class TestUtils {

    public static final double INITIAL_EASE_FACTOR = 2.5;
    public static final double MINIMUM_EASE_FACTOR = 1.3;
    public static final int RELEARNING_DELAY_MIN = 10;
    public static final int MAX_INTERVAL_DAYS = 36500;

    public static SchedulingEngine getTestSchedulingEngine() {
        return new SchedulingEngine(INITIAL_EASE_FACTOR, MINIMUM_EASE_FACTOR, RELEARNING_DELAY_MIN, MAX_INTERVAL_DAYS);
    }

    public static ReviewRecord buildReviewRecord(String ownerId, String itemId, Instant lastReviewedAt, int intervalDays) {
        return new ReviewRecord(itemId, ownerId, lastReviewedAt.plus(Duration.ofDays(intervalDays)), INITIAL_EASE_FACTOR,
                intervalDays, 2, Grade.Good, lastReviewedAt);
    }

    public static ReviewRecord buildDueReviewRecord(String ownerId, String itemId, Instant dueAt, int intervalDays, Instant lastReviewedAt) {
        return new ReviewRecord(itemId, ownerId, dueAt, INITIAL_EASE_FACTOR, intervalDays, 2, Grade.Good, lastReviewedAt);
    }
}
