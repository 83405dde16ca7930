package com.gt.srs.review;

@FunctionalInterface
public interface ReviewStoreListener {

    void onReviewStoreEvent(ReviewStoreEvent event);
}
