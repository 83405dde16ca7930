package com.gt.srs.model;

// Reporting only, never stored
public enum MaturityBand {
    Learning,
    Reviewing,
    Mature;

    static final int LEARNING_MAX_EXCLUSIVE_DAYS = 7;
    static final int MATURE_MIN_DAYS = 21;

    public static MaturityBand forInterval(int intervalDays) {
        if (intervalDays < LEARNING_MAX_EXCLUSIVE_DAYS) {
            return Learning;
        } else if (intervalDays >= MATURE_MIN_DAYS) {
            return Mature;
        }

        return Reviewing;
    }
}
