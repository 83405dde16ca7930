package com.gt.srs.review;

@FunctionalInterface
public interface ReviewUpdateSubscription extends AutoCloseable {

    @Override
    void close();
}
