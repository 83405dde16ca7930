package com.gt.srs.summary;

import com.gt.srs.model.ReviewRecord;
import com.gt.srs.review.ReviewStore;
import com.gt.srs.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class DueSetQueryTests {

    private static final String TEST_OWNER_ID = "test_user";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static final ReviewRecord OVERDUE = TestUtils.buildDueReviewRecord(TEST_OWNER_ID, "item-d", NOW.minus(Duration.ofDays(2)), 3, NOW.minus(Duration.ofDays(5)));
    private static final ReviewRecord DUE_NOW_B = TestUtils.buildDueReviewRecord(TEST_OWNER_ID, "item-b", NOW, 1, NOW.minus(Duration.ofDays(1)));
    private static final ReviewRecord DUE_NOW_A = TestUtils.buildDueReviewRecord(TEST_OWNER_ID, "item-a", NOW, 1, NOW.minus(Duration.ofDays(1)));
    private static final ReviewRecord NOT_YET_DUE = TestUtils.buildDueReviewRecord(TEST_OWNER_ID, "item-c", NOW.plusSeconds(1), 1, NOW.minus(Duration.ofDays(1)));
    private static final ReviewRecord LATER = TestUtils.buildDueReviewRecord(TEST_OWNER_ID, "item-e", NOW.plus(Duration.ofDays(4)), 8, NOW.minus(Duration.ofDays(4)));

    @Mock private ReviewStore reviewStore;

    private DueSetQuery dueSetQuery;

    @BeforeEach
    public void setup() {
        dueSetQuery = new DueSetQuery();
    }

    @Test
    public void testDueItems() {
        when(reviewStore.records()).thenReturn(List.of(LATER, DUE_NOW_B, NOT_YET_DUE, OVERDUE, DUE_NOW_A));

        List<ReviewRecord> dueItems = dueSetQuery.dueItems(reviewStore, NOW);

        assertEquals(List.of(OVERDUE, DUE_NOW_A, DUE_NOW_B), dueItems);
    }

    @Test
    public void testDueItems_EmptyStore() {
        when(reviewStore.records()).thenReturn(List.of());

        assertTrue(dueSetQuery.dueItems(reviewStore, NOW).isEmpty());
        assertEquals(0, dueSetQuery.dueCount(reviewStore, NOW));
        assertEquals(Optional.empty(), dueSetQuery.nextDueAt(reviewStore, NOW));
    }

    @Test
    public void testDueItems_BecomeDueAsTimePasses() {
        when(reviewStore.records()).thenReturn(List.of(LATER, DUE_NOW_B, NOT_YET_DUE, OVERDUE, DUE_NOW_A));

        assertEquals(3, dueSetQuery.dueCount(reviewStore, NOW));
        assertEquals(4, dueSetQuery.dueCount(reviewStore, NOW.plusSeconds(1)));
        assertEquals(5, dueSetQuery.dueCount(reviewStore, NOW.plus(Duration.ofDays(4))));
        assertEquals(1, dueSetQuery.dueCount(reviewStore, NOW.minus(Duration.ofDays(1))));
    }

    @Test
    public void testDueCountMatchesDueItems() {
        when(reviewStore.records()).thenReturn(List.of(LATER, DUE_NOW_B, NOT_YET_DUE, OVERDUE, DUE_NOW_A));

        for (int hour = -72; hour <= 120; hour += 6) {
            Instant now = NOW.plus(Duration.ofHours(hour));
            assertEquals(dueSetQuery.dueItems(reviewStore, now).size(), dueSetQuery.dueCount(reviewStore, now));
        }
    }

    @Test
    public void testNextDueAt() {
        when(reviewStore.records()).thenReturn(List.of(LATER, DUE_NOW_B, NOT_YET_DUE, OVERDUE, DUE_NOW_A));

        assertEquals(Optional.of(NOT_YET_DUE.dueAt()), dueSetQuery.nextDueAt(reviewStore, NOW));
        assertEquals(Optional.of(LATER.dueAt()), dueSetQuery.nextDueAt(reviewStore, NOW.plusSeconds(1)));
        assertEquals(Optional.empty(), dueSetQuery.nextDueAt(reviewStore, LATER.dueAt()));
    }
}
