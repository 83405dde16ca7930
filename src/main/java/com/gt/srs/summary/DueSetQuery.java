package com.gt.srs.summary;

import com.gt.srs.model.ReviewRecord;
import com.gt.srs.review.ReviewStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

// Recomputed from the store on every call
@Component
public class DueSetQuery {

    static final Comparator<ReviewRecord> DUE_ORDER =
            Comparator.comparing(ReviewRecord::dueAt).thenComparing(ReviewRecord::itemId);

    public List<ReviewRecord> dueItems(ReviewStore reviewStore, Instant now) {
        return reviewStore.records()
                .stream()
                .filter(reviewRecord -> reviewRecord.isDue(now))
                .sorted(DUE_ORDER)
                .toList();
    }

    public int dueCount(ReviewStore reviewStore, Instant now) {
        return (int) reviewStore.records()
                .stream()
                .filter(reviewRecord -> reviewRecord.isDue(now))
                .count();
    }

    public Optional<Instant> nextDueAt(ReviewStore reviewStore, Instant now) {
        return reviewStore.records()
                .stream()
                .map(ReviewRecord::dueAt)
                .filter(dueAt -> dueAt.isAfter(now))
                .min(Comparator.naturalOrder());
    }
}
