package com.gt.srs.summary;

import com.gt.srs.model.Grade;
import com.gt.srs.model.ReviewRecord;
import com.gt.srs.model.ReviewStats;
import com.gt.srs.review.ReviewStore;
import com.gt.srs.util.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class StatsAggregatorTests {

    private static final String TEST_OWNER_ID = "test_user";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock private ReviewStore reviewStore;

    @Test
    public void testStats_EmptyStore() {
        when(reviewStore.records()).thenReturn(List.of());

        assertEquals(ReviewStats.EMPTY, new StatsAggregator("UTC").stats(reviewStore, NOW));
    }

    @Test
    public void testStats() {
        when(reviewStore.records()).thenReturn(List.of(
                // learning, reviewed today, due
                TestUtils.buildDueReviewRecord(TEST_OWNER_ID, "item-1", NOW.minus(Duration.ofMinutes(5)), 0, NOW.minus(Duration.ofMinutes(15))),
                // learning, reviewed yesterday, not due
                TestUtils.buildReviewRecord(TEST_OWNER_ID, "item-2", NOW.minus(Duration.ofDays(1)), 3),
                // reviewing, due
                TestUtils.buildReviewRecord(TEST_OWNER_ID, "item-3", NOW.minus(Duration.ofDays(10)), 10),
                // reviewing at the upper edge
                TestUtils.buildReviewRecord(TEST_OWNER_ID, "item-4", NOW.minus(Duration.ofDays(2)), 20),
                // mature at the lower edge, reviewed today
                TestUtils.buildReviewRecord(TEST_OWNER_ID, "item-5", NOW.minus(Duration.ofHours(2)), 21),
                // mature, no review time
                new ReviewRecord("item-6", TEST_OWNER_ID, NOW.plus(Duration.ofDays(30)), 2.5, 90, 6, Grade.Easy, null)));

        ReviewStats reviewStats = new StatsAggregator("UTC").stats(reviewStore, NOW);

        assertEquals(new ReviewStats(6, 2, 2, 2, 2), reviewStats);
    }

    @Test
    public void testStats_ReviewedTodayUsesConfiguredZone() {
        // 23:30 UTC on April 30 is 08:30 May 1 in Tokyo
        Instant lateEvening = Instant.parse("2024-04-30T23:30:00Z");
        Instant morning = Instant.parse("2024-05-01T02:00:00Z");
        when(reviewStore.records()).thenReturn(List.of(TestUtils.buildReviewRecord(TEST_OWNER_ID, "item-1", lateEvening, 1)));

        assertEquals(0, new StatsAggregator("UTC").stats(reviewStore, morning).reviewedToday());
        assertEquals(1, new StatsAggregator("Asia/Tokyo").stats(reviewStore, morning).reviewedToday());
    }
}
