package com.gt.srs.review;

import com.gt.srs.model.ReviewRecord;
import com.gt.srs.review.model.DBReviewRecord;

import java.time.Instant;
import java.util.List;

public interface ReviewRecordDao {

    List<ReviewRecord> getReviewRecords(String ownerId);

    // Returns the number of rows written. Zero means the stored row was reviewed more recently.
    int saveReviewRecord(ReviewRecord reviewRecord);

    int deleteReviewRecord(String ownerId, String itemId);

    List<DBReviewRecord> getReviewRecordsUpdatedSince(String ownerId, Instant since);
}
