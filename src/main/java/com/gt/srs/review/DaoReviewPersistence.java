package com.gt.srs.review;

import com.gt.srs.exception.DaoException;
import com.gt.srs.model.ReviewRecord;
import com.gt.srs.review.model.DBReviewRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

// Runs the blocking DAO on a dedicated executor, and turns table changes into an update stream by polling.
// update_instant is the writing transaction's start time, so rows can commit behind the watermark. Each poll looks
// back by a fixed overlap and may deliver a record more than once; subscribers must ignore repeats.
@Component
public class DaoReviewPersistence implements ReviewPersistence {

    private static final Logger log = LoggerFactory.getLogger(DaoReviewPersistence.class);

    private final ReviewRecordDao reviewRecordDao;
    private final Executor executor;
    private final Clock clock;
    private final Duration pollOverlap;

    private final Map<String, UpdateFeed> updateFeeds = new ConcurrentHashMap<>();

    @Autowired
    public DaoReviewPersistence(ReviewRecordDao reviewRecordDao,
                                @Qualifier("reviewPersistenceExecutor") Executor executor,
                                Clock clock,
                                @Value("${srs.persistence.updatePollOverlapMs}") long pollOverlapMs) {
        this.reviewRecordDao = reviewRecordDao;
        this.executor = executor;
        this.clock = clock;
        this.pollOverlap = Duration.ofMillis(pollOverlapMs);
    }

    @Override
    public CompletableFuture<List<ReviewRecord>> fetchReviews(String ownerId) {
        return CompletableFuture.supplyAsync(() -> reviewRecordDao.getReviewRecords(ownerId), executor);
    }

    @Override
    public CompletableFuture<ReviewRecord> saveReview(ReviewRecord reviewRecord) {
        return CompletableFuture.supplyAsync(() -> {
            reviewRecordDao.saveReviewRecord(reviewRecord);
            return reviewRecord;
        }, executor);
    }

    @Override
    public CompletableFuture<Boolean> deleteReview(String ownerId, String itemId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                reviewRecordDao.deleteReviewRecord(ownerId, itemId);
                return true;
            } catch (DaoException ex) {
                log.warn("Unable to delete review record for item {} of {}", itemId, ownerId, ex);
                return false;
            }
        }, executor);
    }

    @Override
    public ReviewUpdateSubscription streamUpdates(String ownerId, Consumer<ReviewRecord> listener) {
        UpdateFeed updateFeed = updateFeeds.computeIfAbsent(ownerId, id -> new UpdateFeed(clock.instant()));
        updateFeed.listeners.add(listener);

        return () -> {
            updateFeed.listeners.remove(listener);
            updateFeeds.computeIfPresent(ownerId, (id, feed) -> feed.listeners.isEmpty() ? null : feed);
        };
    }

    @Scheduled(fixedDelayString = "${srs.persistence.updatePollMs}", initialDelayString = "${srs.persistence.updatePollMs}")
    public void pollUpdates() {
        updateFeeds.forEach(this::pollOwnerUpdates);
    }

    private void pollOwnerUpdates(String ownerId, UpdateFeed updateFeed) {
        List<DBReviewRecord> updatedRecords;
        try {
            updatedRecords = reviewRecordDao.getReviewRecordsUpdatedSince(ownerId, updateFeed.watermark.minus(pollOverlap));
        } catch (DaoException ex) {
            log.warn("Polling review updates for {} failed. Will retry on next poll.", ownerId, ex);
            return;
        }

        for (DBReviewRecord updatedRecord : updatedRecords) {
            ReviewRecord reviewRecord = updatedRecord.toReviewRecord();
            updateFeed.listeners.forEach(listener -> listener.accept(reviewRecord));

            if (updatedRecord.updateInstant() != null && updatedRecord.updateInstant().isAfter(updateFeed.watermark)) {
                updateFeed.watermark = updatedRecord.updateInstant();
            }
        }

        if (!updatedRecords.isEmpty()) {
            log.debug("Pushed {} review updates for {}", updatedRecords.size(), ownerId);
        }
    }

    private static class UpdateFeed {
        private final List<Consumer<ReviewRecord>> listeners = new CopyOnWriteArrayList<>();
        private volatile Instant watermark;

        private UpdateFeed(Instant watermark) {
            this.watermark = watermark;
        }
    }
}
