package com.gt.srs.review;

import com.gt.srs.model.ReviewRecord;

// record is the new state for Graded and Reconciled, the removed state for Reset, and null for load events
public record ReviewStoreEvent(String ownerId,
                               Type type,
                               String itemId,
                               ReviewRecord record) {

    public enum Type {
        Graded,
        Reset,
        Reconciled,
        Loaded,
        LoadFailed,
        PersistFailed,
        DeleteFailed
    }
}
