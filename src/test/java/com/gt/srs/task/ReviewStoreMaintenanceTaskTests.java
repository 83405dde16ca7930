package com.gt.srs.task;

import com.gt.srs.review.ReviewStoreManager;
import com.gt.srs.util.TestClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class ReviewStoreMaintenanceTaskTests {

    @Mock private ReviewStoreManager reviewStoreManager;

    @Test
    public void testPerformMaintenance() {
        TestClock clock = new TestClock(Instant.parse("2024-05-08T00:00:00Z"));
        when(reviewStoreManager.purgeResetMarkers(any(Instant.class))).thenReturn(4);

        new ReviewStoreMaintenanceTask(reviewStoreManager, clock, 7, 60).performMaintenance();

        verify(reviewStoreManager).purgeResetMarkers(Instant.parse("2024-05-01T00:00:00Z"));
    }

    @Test
    public void testReleaseIdleStores() {
        TestClock clock = new TestClock(Instant.parse("2024-05-08T12:00:00Z"));
        when(reviewStoreManager.releaseIdleStores(any(Instant.class))).thenReturn(2);

        new ReviewStoreMaintenanceTask(reviewStoreManager, clock, 7, 60).releaseIdleStores();

        verify(reviewStoreManager).releaseIdleStores(Instant.parse("2024-05-08T11:00:00Z"));
    }
}
