package com.gt.srs.review;

import com.gt.srs.model.ReviewRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Durable mirror of a learner's review records. All operations are asynchronous and may be retried by the
 * implementation; callers never block on them.
 */
public interface ReviewPersistence {

    CompletableFuture<List<ReviewRecord>> fetchReviews(String ownerId);

    CompletableFuture<ReviewRecord> saveReview(ReviewRecord reviewRecord);

    // Completes with false rather than exceptionally when the deletion fails
    CompletableFuture<Boolean> deleteReview(String ownerId, String itemId);

    ReviewUpdateSubscription streamUpdates(String ownerId, Consumer<ReviewRecord> listener);
}
