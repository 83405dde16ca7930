package com.gt.srs.review;

import com.gt.srs.exception.InvalidRequestException;
import com.gt.srs.model.Grade;
import com.gt.srs.model.ReviewRecord;
import com.gt.srs.model.ReviewStats;
import com.gt.srs.summary.DueSetQuery;
import com.gt.srs.summary.StatsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/rest/review")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewStoreManager reviewStoreManager;
    private final DueSetQuery dueSetQuery;
    private final StatsAggregator statsAggregator;
    private final Clock clock;

    public ReviewController(ReviewStoreManager reviewStoreManager,
                            DueSetQuery dueSetQuery,
                            StatsAggregator statsAggregator,
                            Clock clock) {
        this.reviewStoreManager = reviewStoreManager;
        this.dueSetQuery = dueSetQuery;
        this.statsAggregator = statsAggregator;
        this.clock = clock;
    }

    @PostMapping(value = "/recordGrading", consumes = "application/json", produces = "application/json")
    public ReviewRecord recordGrading(@RequestBody RecordGradingRequest request) {
        verifyId("ownerId", request.ownerId());
        verifyId("itemId", request.itemId());
        if (request.grade() == null) {
            throw new InvalidRequestException("grade is required");
        }

        return reviewStoreManager.getStore(request.ownerId()).recordGrading(request.itemId(), request.grade());
    }

    @PostMapping(value = "/resetItem", consumes = "application/json", produces = "application/json")
    public CompletableFuture<Boolean> resetItem(@RequestBody ResetItemRequest request) {
        verifyId("ownerId", request.ownerId());
        verifyId("itemId", request.itemId());

        return reviewStoreManager.getStore(request.ownerId()).resetItem(request.itemId());
    }

    @PostMapping(value = "/load", consumes = "application/json", produces = "application/json")
    public CompletableFuture<ReviewStoreStatus> load(@RequestBody LoadRequest request) {
        verifyId("ownerId", request.ownerId());

        ReviewStore reviewStore = reviewStoreManager.getStore(request.ownerId());
        log.info("Reloading review records for {}", request.ownerId());

        return reviewStore.load().thenApply(ignored -> buildStatus(reviewStore, clock.instant()));
    }

    @GetMapping(value = "/dueItems", produces = "application/json")
    public List<ReviewRecord> getDueItems(@RequestParam(value = "ownerId") String ownerId) {
        verifyId("ownerId", ownerId);

        return dueSetQuery.dueItems(reviewStoreManager.getStore(ownerId), clock.instant());
    }

    @GetMapping(value = "/dueCount", produces = "application/json")
    public int getDueCount(@RequestParam(value = "ownerId") String ownerId) {
        verifyId("ownerId", ownerId);

        return dueSetQuery.dueCount(reviewStoreManager.getStore(ownerId), clock.instant());
    }

    @GetMapping(value = "/stats", produces = "application/json")
    public ReviewStats getStats(@RequestParam(value = "ownerId") String ownerId) {
        verifyId("ownerId", ownerId);

        return statsAggregator.stats(reviewStoreManager.getStore(ownerId), clock.instant());
    }

    @GetMapping(value = "/status", produces = "application/json")
    public ReviewStoreStatus getStatus(@RequestParam(value = "ownerId") String ownerId) {
        verifyId("ownerId", ownerId);

        return buildStatus(reviewStoreManager.getStore(ownerId), clock.instant());
    }

    private ReviewStoreStatus buildStatus(ReviewStore reviewStore, Instant now) {
        return new ReviewStoreStatus(reviewStore.loadState(), reviewStore.hasPersistenceError(),
                dueSetQuery.nextDueAt(reviewStore, now).orElse(null));
    }

    private static void verifyId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(name + " is required");
        }
    }

    private record RecordGradingRequest(String ownerId, String itemId, Grade grade) { }
    private record ResetItemRequest(String ownerId, String itemId) { }
    private record LoadRequest(String ownerId) { }

    public record ReviewStoreStatus(LoadState loadState, boolean persistenceError, Instant nextDueAt) { }
}
