package com.gt.srs.scheduling;

import com.gt.srs.model.Grade;
import com.gt.srs.model.ReviewRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * SM-2 style scheduler. Given the current state of an item (or its absence) and the grade just reported, produces
 * the item's next state. Pure: the result depends only on the arguments and the configured constants.
 */
@Component
public class SchedulingEngine {

    // Recorded after Again. The item is re-learning and its due time is not day-scaled.
    public static final int LEARNING_INTERVAL_DAYS = 0;

    static final int HARD_OR_GOOD_INITIAL_INTERVAL_DAYS = 1;
    static final int EASY_INITIAL_INTERVAL_DAYS = 3;

    private final double initialEaseFactor;
    private final double minimumEaseFactor;
    private final Duration relearningDelay;
    private final int maxIntervalDays;

    @Autowired
    public SchedulingEngine(@Value("${srs.scheduling.initialEaseFactor}") double initialEaseFactor,
                            @Value("${srs.scheduling.minimumEaseFactor}") double minimumEaseFactor,
                            @Value("${srs.scheduling.relearningDelayMin}") int relearningDelayMin,
                            @Value("${srs.scheduling.maxIntervalDays}") int maxIntervalDays) {
        this.initialEaseFactor = initialEaseFactor;
        this.minimumEaseFactor = minimumEaseFactor;
        this.relearningDelay = Duration.ofMinutes(relearningDelayMin);
        this.maxIntervalDays = maxIntervalDays;
    }

    public ReviewRecord computeNext(String ownerId, String itemId, Optional<ReviewRecord> previous, Grade grade, Instant now) {
        return previous
                .map(previousRecord -> scheduleExistingItem(previousRecord, grade, now))
                .orElseGet(() -> scheduleNewItem(ownerId, itemId, grade, now));
    }

    private ReviewRecord scheduleNewItem(String ownerId, String itemId, Grade grade, Instant now) {
        int intervalDays = switch (grade) {
            case Again -> LEARNING_INTERVAL_DAYS;
            case Hard, Good -> HARD_OR_GOOD_INITIAL_INTERVAL_DAYS;
            case Easy -> EASY_INITIAL_INTERVAL_DAYS;
        };

        return new ReviewRecord(
                itemId,
                ownerId,
                calculateDueAt(grade, intervalDays, now),
                initialEaseFactor,
                intervalDays,
                1,
                grade,
                now);
    }

    private ReviewRecord scheduleExistingItem(ReviewRecord previous, Grade grade, Instant now) {
        double newEaseFactor = calculateEaseFactor(previous.easeFactor(), grade);

        // The penalized ease only affects growth after the item is passed again
        int newIntervalDays = grade == Grade.Again
                ? LEARNING_INTERVAL_DAYS
                : calculateIntervalDays(previous.intervalDays(), newEaseFactor);

        return new ReviewRecord(
                previous.itemId(),
                previous.ownerId(),
                calculateDueAt(grade, newIntervalDays, now),
                newEaseFactor,
                newIntervalDays,
                previous.repetitionCount() + 1,
                grade,
                now);
    }

    double calculateEaseFactor(double easeFactor, Grade grade) {
        int missedQuality = Grade.Easy.getQuality() - grade.getQuality();
        double adjusted = easeFactor + (0.1 - missedQuality * (0.08 + missedQuality * 0.02));

        return Math.max(minimumEaseFactor, roundToHundredths(adjusted));
    }

    int calculateIntervalDays(int previousIntervalDays, double easeFactor) {
        long grown = Math.round(previousIntervalDays * easeFactor);

        return (int) Math.min(maxIntervalDays, Math.max(1, grown));
    }

    private Instant calculateDueAt(Grade grade, int intervalDays, Instant now) {
        if (grade == Grade.Again) {
            return now.plus(relearningDelay);
        }

        return now.plus(Duration.ofDays(intervalDays));
    }

    private static double roundToHundredths(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
