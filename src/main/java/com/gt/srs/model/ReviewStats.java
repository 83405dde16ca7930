package com.gt.srs.model;

public record ReviewStats(int total,
                          int due,
                          int reviewedToday,
                          int learning,
                          int mature) {

    public static final ReviewStats EMPTY = new ReviewStats(0, 0, 0, 0, 0);
}
