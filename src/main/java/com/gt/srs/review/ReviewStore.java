package com.gt.srs.review;

import com.gt.srs.model.Grade;
import com.gt.srs.model.ReviewRecord;
import com.gt.srs.scheduling.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Authoritative in-memory review records of a single learner.
 *
 * <p>Local state changes as soon as a grading or reset is made; the durable mirror is updated afterwards. Remote
 * operations for one item are serialized: while one is in flight, later ones wait in a single slot where the newest
 * replaces the older. Data from persistence only enters through {@link #load()} and {@link #reconcile(ReviewRecord)},
 * both of which apply last-write-wins on {@code lastReviewedAt}.
 *
 * <p>State is guarded by the store's monitor. Persistence calls and listener notifications are made after the
 * monitor is released.
 */
public class ReviewStore {

    private static final Logger log = LoggerFactory.getLogger(ReviewStore.class);

    private final String ownerId;
    private final SchedulingEngine schedulingEngine;
    private final ReviewPersistence reviewPersistence;
    private final Clock clock;

    private final Map<String, ReviewRecord> records = new HashMap<>();
    private final Map<String, Instant> resetMarkers = new HashMap<>();
    private final Map<String, RemoteOperations> remoteOperations = new HashMap<>();
    private final Set<String> changedWhileLoading = new HashSet<>();
    private final Set<String> failedSaves = new HashSet<>();
    private final Deque<Runnable> deferredActions = new ArrayDeque<>();
    private final List<ReviewStoreListener> listeners = new CopyOnWriteArrayList<>();

    private LoadState loadState = LoadState.NotLoaded;
    private long loadGeneration = 0;
    private boolean persistenceError = false;

    public ReviewStore(String ownerId, SchedulingEngine schedulingEngine, ReviewPersistence reviewPersistence, Clock clock) {
        this.ownerId = ownerId;
        this.schedulingEngine = schedulingEngine;
        this.reviewPersistence = reviewPersistence;
        this.clock = clock;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public ReviewRecord recordGrading(String itemId, Grade grade) {
        ReviewRecord newRecord;

        synchronized (this) {
            Instant now = clock.instant();
            newRecord = schedulingEngine.computeNext(ownerId, itemId, Optional.ofNullable(records.get(itemId)), grade, now);

            records.put(itemId, newRecord);
            resetMarkers.remove(itemId);
            markChangedWhileLoading(itemId);
            enqueueRemoteOperation(itemId, RemoteOperation.save(newRecord));
            deferEvent(ReviewStoreEvent.Type.Graded, itemId, newRecord);
        }
        runDeferredActions();

        log.debug("Graded item {} of {} as {}. Next due at {}", itemId, ownerId, grade, newRecord.dueAt());
        return newRecord;
    }

    /**
     * Removes the item from review tracking. The local removal is immediate; the returned future reports whether
     * the durable copy was deleted.
     */
    public CompletableFuture<Boolean> resetItem(String itemId) {
        RemoteOperation deleteOperation = RemoteOperation.delete();

        synchronized (this) {
            ReviewRecord removedRecord = records.remove(itemId);

            resetMarkers.put(itemId, clock.instant());
            failedSaves.remove(itemId);
            markChangedWhileLoading(itemId);
            enqueueRemoteOperation(itemId, deleteOperation);
            deferEvent(ReviewStoreEvent.Type.Reset, itemId, removedRecord);
        }
        runDeferredActions();

        return deleteOperation.deleteResult;
    }

    /**
     * Replaces the collection with the records held by persistence. Never completes exceptionally: a failed fetch
     * leaves the collection empty and the load state {@link LoadState#Failed}. Items graded or reset while the fetch
     * is outstanding, and items whose latest change is not yet durable, keep their local state unless the fetched copy
     * is newer. Local records whose save failed are written again.
     */
    public CompletableFuture<Void> load() {
        long generation;

        synchronized (this) {
            if (loadState != LoadState.Loading) {
                changedWhileLoading.clear();
            }
            loadState = LoadState.Loading;
            generation = ++loadGeneration;
        }

        CompletableFuture<List<ReviewRecord>> fetch;
        try {
            fetch = reviewPersistence.fetchReviews(ownerId);
        } catch (RuntimeException ex) {
            fetch = CompletableFuture.failedFuture(ex);
        }

        return fetch.handle((fetchedRecords, ex) -> {
            applyLoad(generation, fetchedRecords, ex);
            return (Void) null;
        });
    }

    /**
     * Applies a record pushed by persistence. Returns true if it replaced local state. A record only wins if its
     * lastReviewedAt is strictly after that of the local record, or of the local reset if the item was reset.
     */
    public boolean reconcile(ReviewRecord remoteRecord) {
        if (!isAcceptableRemoteRecord(remoteRecord)) {
            log.warn("Ignoring malformed review record pushed for {}: {}", ownerId, remoteRecord);
            return false;
        }

        synchronized (this) {
            String itemId = remoteRecord.itemId();
            if (!isNewerThanLocal(remoteRecord, records.get(itemId), resetMarkers.get(itemId))) {
                return false;
            }

            records.put(itemId, remoteRecord);
            resetMarkers.remove(itemId);
            failedSaves.remove(itemId);
            markChangedWhileLoading(itemId);

            // Anything still waiting to be written is older than what was just received
            RemoteOperations itemOperations = remoteOperations.get(itemId);
            if (itemOperations != null && itemOperations.queued != null) {
                deferSuperseded(itemOperations.queued);
                itemOperations.queued = null;
            }

            deferEvent(ReviewStoreEvent.Type.Reconciled, itemId, remoteRecord);
        }
        runDeferredActions();

        return true;
    }

    public synchronized List<ReviewRecord> records() {
        return List.copyOf(records.values());
    }

    public synchronized Optional<ReviewRecord> find(String itemId) {
        return Optional.ofNullable(records.get(itemId));
    }

    public synchronized LoadState loadState() {
        return loadState;
    }

    // Set when the last remote operation failed, cleared by the next one that succeeds
    public synchronized boolean hasPersistenceError() {
        return persistenceError;
    }

    public synchronized boolean hasPendingRemoteOperation(String itemId) {
        return remoteOperations.containsKey(itemId);
    }

    // True while any change is in flight, queued, or failed to save
    public synchronized boolean hasUnsavedChanges() {
        return !remoteOperations.isEmpty() || !failedSaves.isEmpty();
    }

    public void addListener(ReviewStoreListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ReviewStoreListener listener) {
        listeners.remove(listener);
    }

    public synchronized int purgeResetMarkers(Instant cutoff) {
        int purgedCnt = 0;

        Iterator<Map.Entry<String, Instant>> resetMarkerIterator = resetMarkers.entrySet().iterator();
        while (resetMarkerIterator.hasNext()) {
            Map.Entry<String, Instant> resetMarker = resetMarkerIterator.next();
            if (resetMarker.getValue().isBefore(cutoff) && !remoteOperations.containsKey(resetMarker.getKey())) {
                resetMarkerIterator.remove();
                purgedCnt++;
            }
        }

        return purgedCnt;
    }

    private void applyLoad(long generation, List<ReviewRecord> fetchedRecords, Throwable fetchException) {
        synchronized (this) {
            if (generation != loadGeneration) {
                log.debug("Discarding superseded load of {}", ownerId);
                return;
            }

            Map<String, ReviewRecord> loadedRecords = new HashMap<>();
            if (fetchException == null && fetchedRecords != null) {
                for (ReviewRecord fetchedRecord : fetchedRecords) {
                    if (!isAcceptableRemoteRecord(fetchedRecord)) {
                        log.warn("Skipping malformed review record loaded for {}: {}", ownerId, fetchedRecord);
                    } else if (!resetMarkers.containsKey(fetchedRecord.itemId())) {
                        loadedRecords.put(fetchedRecord.itemId(), fetchedRecord);
                    } else if (isNewerThanLocal(fetchedRecord, null, resetMarkers.get(fetchedRecord.itemId()))) {
                        loadedRecords.put(fetchedRecord.itemId(), fetchedRecord);
                        resetMarkers.remove(fetchedRecord.itemId());
                    }
                }
            }

            Set<String> locallyOwnedItems = new HashSet<>(changedWhileLoading);
            locallyOwnedItems.addAll(remoteOperations.keySet());
            locallyOwnedItems.addAll(failedSaves);

            for (String itemId : locallyOwnedItems) {
                ReviewRecord fetchedRecord = loadedRecords.get(itemId);
                ReviewRecord localRecord = records.get(itemId);

                if (fetchedRecord != null && isNewerThanLocal(fetchedRecord, localRecord, resetMarkers.get(itemId))) {
                    resetMarkers.remove(itemId);
                    failedSaves.remove(itemId);

                    RemoteOperations itemOperations = remoteOperations.get(itemId);
                    if (itemOperations != null && itemOperations.queued != null) {
                        deferSuperseded(itemOperations.queued);
                        itemOperations.queued = null;
                    }
                } else if (localRecord == null) {
                    loadedRecords.remove(itemId);
                } else {
                    loadedRecords.put(itemId, localRecord);
                }
            }
            changedWhileLoading.clear();

            for (String itemId : List.copyOf(failedSaves)) {
                ReviewRecord unsavedRecord = loadedRecords.get(itemId);
                if (unsavedRecord != null) {
                    enqueueRemoteOperation(itemId, RemoteOperation.save(unsavedRecord));
                }
            }

            records.clear();
            records.putAll(loadedRecords);

            if (fetchException == null) {
                loadState = LoadState.Loaded;
                deferEvent(ReviewStoreEvent.Type.Loaded, null, null);
            } else {
                loadState = LoadState.Failed;
                deferEvent(ReviewStoreEvent.Type.LoadFailed, null, null);
            }
        }
        runDeferredActions();

        if (fetchException == null) {
            log.info("Loaded {} review records for {}", fetchedRecords == null ? 0 : fetchedRecords.size(), ownerId);
        } else {
            log.error("Failed to load review records for {}", ownerId, fetchException);
        }
    }

    // Caller holds the monitor
    private void enqueueRemoteOperation(String itemId, RemoteOperation operation) {
        RemoteOperations itemOperations = remoteOperations.get(itemId);

        if (itemOperations == null) {
            remoteOperations.put(itemId, new RemoteOperations(operation));
            deferredActions.add(() -> startRemoteOperation(itemId, operation));
        } else {
            if (itemOperations.queued != null) {
                deferSuperseded(itemOperations.queued);
            }
            itemOperations.queued = operation;
        }
    }

    private void startRemoteOperation(String itemId, RemoteOperation operation) {
        if (operation.isDelete()) {
            CompletableFuture<Boolean> deletion;
            try {
                deletion = reviewPersistence.deleteReview(ownerId, itemId);
            } catch (RuntimeException ex) {
                deletion = CompletableFuture.failedFuture(ex);
            }

            deletion.whenComplete((deleted, ex) -> completeRemoteOperation(itemId, operation, ex == null && Boolean.TRUE.equals(deleted), ex));
        } else {
            CompletableFuture<ReviewRecord> save;
            try {
                save = reviewPersistence.saveReview(operation.recordToSave);
            } catch (RuntimeException ex) {
                save = CompletableFuture.failedFuture(ex);
            }

            save.whenComplete((saved, ex) -> completeRemoteOperation(itemId, operation, ex == null, ex));
        }
    }

    private void completeRemoteOperation(String itemId, RemoteOperation operation, boolean succeeded, Throwable ex) {
        synchronized (this) {
            RemoteOperations itemOperations = remoteOperations.get(itemId);

            if (itemOperations != null && itemOperations.inFlight == operation) {
                if (itemOperations.queued != null) {
                    RemoteOperation nextOperation = itemOperations.queued;
                    itemOperations.inFlight = nextOperation;
                    itemOperations.queued = null;
                    deferredActions.add(() -> startRemoteOperation(itemId, nextOperation));
                } else {
                    remoteOperations.remove(itemId);
                }
            }

            persistenceError = !succeeded;
            if (!operation.isDelete()) {
                if (succeeded) {
                    failedSaves.remove(itemId);
                } else {
                    failedSaves.add(itemId);
                }
            }
            if (!succeeded) {
                deferEvent(operation.isDelete() ? ReviewStoreEvent.Type.DeleteFailed : ReviewStoreEvent.Type.PersistFailed,
                        itemId, operation.recordToSave);
            }
            if (operation.isDelete()) {
                deferredActions.add(() -> operation.deleteResult.complete(succeeded));
            }
        }
        runDeferredActions();

        if (!succeeded) {
            if (operation.isDelete()) {
                log.warn("Remote deletion of item {} for {} failed", itemId, ownerId, ex);
            } else {
                log.warn("Remote save of item {} for {} failed. Local state is kept.", itemId, ownerId, ex);
            }
        }
    }

    // A queued save that is replaced never runs. A queued delete that is replaced reports that nothing was deleted.
    private void deferSuperseded(RemoteOperation operation) {
        if (operation.isDelete()) {
            deferredActions.add(() -> operation.deleteResult.complete(false));
        }
    }

    private void markChangedWhileLoading(String itemId) {
        if (loadState == LoadState.Loading) {
            changedWhileLoading.add(itemId);
        }
    }

    private void deferEvent(ReviewStoreEvent.Type type, String itemId, ReviewRecord record) {
        ReviewStoreEvent event = new ReviewStoreEvent(ownerId, type, itemId, record);
        deferredActions.add(() -> notifyListeners(event));
    }

    private void notifyListeners(ReviewStoreEvent event) {
        for (ReviewStoreListener listener : listeners) {
            try {
                listener.onReviewStoreEvent(event);
            } catch (RuntimeException ex) {
                log.error("Review store listener failed handling {} event for {}", event.type(), ownerId, ex);
            }
        }
    }

    private void runDeferredActions() {
        Runnable action;
        while ((action = pollDeferredAction()) != null) {
            action.run();
        }
    }

    private synchronized Runnable pollDeferredAction() {
        return deferredActions.poll();
    }

    private boolean isAcceptableRemoteRecord(ReviewRecord remoteRecord) {
        return remoteRecord != null
                && ownerId.equals(remoteRecord.ownerId())
                && remoteRecord.itemId() != null && !remoteRecord.itemId().isBlank()
                && remoteRecord.dueAt() != null
                && remoteRecord.repetitionCount() >= 1;
    }

    // A missing timestamp on the candidate counts as older than anything held locally
    private static boolean isNewerThanLocal(ReviewRecord candidate, ReviewRecord localRecord, Instant resetAt) {
        Instant candidateReviewedAt = candidate.lastReviewedAt();
        if (candidateReviewedAt == null) {
            return false;
        }

        if (localRecord != null) {
            return localRecord.lastReviewedAt() == null || candidateReviewedAt.isAfter(localRecord.lastReviewedAt());
        }

        return resetAt == null || candidateReviewedAt.isAfter(resetAt);
    }

    private static class RemoteOperations {
        private RemoteOperation inFlight;
        private RemoteOperation queued;

        private RemoteOperations(RemoteOperation inFlight) {
            this.inFlight = inFlight;
        }
    }

    private static class RemoteOperation {
        private final ReviewRecord recordToSave;
        private final CompletableFuture<Boolean> deleteResult;

        private RemoteOperation(ReviewRecord recordToSave, CompletableFuture<Boolean> deleteResult) {
            this.recordToSave = recordToSave;
            this.deleteResult = deleteResult;
        }

        static RemoteOperation save(ReviewRecord recordToSave) {
            return new RemoteOperation(recordToSave, null);
        }

        static RemoteOperation delete() {
            return new RemoteOperation(null, new CompletableFuture<>());
        }

        boolean isDelete() {
            return deleteResult != null;
        }
    }
}
