package com.gt.srs.review;

import com.gt.srs.scheduling.SchedulingEngine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// Holds one review store per learner. A store is loaded and subscribed to remote updates when first requested, and
// released once it has been idle with nothing left to save.
@Component
public class ReviewStoreManager {

    private static final Logger log = LoggerFactory.getLogger(ReviewStoreManager.class);

    private final SchedulingEngine schedulingEngine;
    private final ReviewPersistence reviewPersistence;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final Map<String, ManagedStore> managedStores = new ConcurrentHashMap<>();

    @Autowired
    public ReviewStoreManager(SchedulingEngine schedulingEngine,
                              ReviewPersistence reviewPersistence,
                              ApplicationEventPublisher applicationEventPublisher,
                              Clock clock) {
        this.schedulingEngine = schedulingEngine;
        this.reviewPersistence = reviewPersistence;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public ReviewStore getStore(String ownerId) {
        Instant now = clock.instant();
        ManagedStore managedStore = managedStores.compute(ownerId, (id, existing) -> {
            ManagedStore accessed = existing != null ? existing : openStore(id);
            accessed.lastAccessedAt = now;
            return accessed;
        });
        managedStore.started();

        return managedStore.reviewStore;
    }

    public void releaseStore(String ownerId) {
        ManagedStore managedStore = managedStores.remove(ownerId);

        if (managedStore != null) {
            managedStore.subscription.close();
            log.info("Released review store for {}", ownerId);
        }
    }

    public int releaseIdleStores(Instant idleCutoff) {
        int releasedCnt = 0;

        for (String ownerId : managedStores.keySet()) {
            ManagedStore[] released = new ManagedStore[1];
            managedStores.computeIfPresent(ownerId, (id, managedStore) -> {
                if (managedStore.lastAccessedAt.isBefore(idleCutoff) && !managedStore.reviewStore.hasUnsavedChanges()) {
                    released[0] = managedStore;
                    return null;
                }
                return managedStore;
            });

            if (released[0] != null) {
                released[0].subscription.close();
                releasedCnt++;
                log.debug("Released idle review store for {}", ownerId);
            }
        }

        return releasedCnt;
    }

    public int purgeResetMarkers(Instant cutoff) {
        int purgedCnt = 0;

        for (ManagedStore managedStore : managedStores.values()) {
            purgedCnt += managedStore.reviewStore.purgeResetMarkers(cutoff);
        }

        return purgedCnt;
    }

    @PreDestroy
    public void closeAll() {
        managedStores.keySet().forEach(this::releaseStore);
    }

    private ManagedStore openStore(String ownerId) {
        ReviewStore reviewStore = new ReviewStore(ownerId, schedulingEngine, reviewPersistence, clock);
        reviewStore.addListener(applicationEventPublisher::publishEvent);

        ReviewUpdateSubscription subscription = reviewPersistence.streamUpdates(ownerId, reviewStore::reconcile);

        log.info("Opened review store for {}", ownerId);
        return new ManagedStore(reviewStore, subscription);
    }

    // Loading is started outside compute so a synchronously completing fetch cannot re-enter the map
    private static class ManagedStore {
        private final ReviewStore reviewStore;
        private final ReviewUpdateSubscription subscription;
        private volatile Instant lastAccessedAt;
        private boolean loadStarted = false;

        private ManagedStore(ReviewStore reviewStore, ReviewUpdateSubscription subscription) {
            this.reviewStore = reviewStore;
            this.subscription = subscription;
        }

        private void started() {
            boolean startLoad;
            synchronized (this) {
                startLoad = !loadStarted;
                loadStarted = true;
            }

            if (startLoad) {
                reviewStore.load();
            }
        }
    }
}
