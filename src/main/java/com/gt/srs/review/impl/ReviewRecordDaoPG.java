package com.gt.srs.review.impl;

import com.gt.srs.exception.DaoException;
import com.gt.srs.model.Grade;
import com.gt.srs.model.ReviewRecord;
import com.gt.srs.review.ReviewRecordDao;
import com.gt.srs.review.model.DBReviewRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ReviewRecordDaoPG implements ReviewRecordDao {

    private static final Logger log = LoggerFactory.getLogger(ReviewRecordDaoPG.class);

    private static final String REVIEW_RECORD_COLUMNS =
            "owner_id, item_id, due_at, ease_factor, interval_days, repetition_count, last_grade, last_reviewed_at, update_instant ";

    private static final String GET_REVIEW_RECORDS_SQL =
            "SELECT " + REVIEW_RECORD_COLUMNS +
            "FROM review_record " +
            "WHERE owner_id = :ownerId";

    // An older write landing late must not regress a row another writer has already advanced
    private static final String SAVE_REVIEW_RECORD_SQL =
            "INSERT INTO review_record " +
                    "(owner_id, item_id, due_at, ease_factor, interval_days, repetition_count, last_grade, last_reviewed_at, update_instant) " +
                    "VALUES (:ownerId, :itemId, :dueAt, :easeFactor, :intervalDays, :repetitionCount, :lastGrade, :lastReviewedAt, now()) " +
            "ON CONFLICT (owner_id, item_id) DO UPDATE " +
                    "SET due_at = :dueAt, ease_factor = :easeFactor, interval_days = :intervalDays, repetition_count = :repetitionCount, " +
                    "last_grade = :lastGrade, last_reviewed_at = :lastReviewedAt, update_instant = now() " +
                    "WHERE review_record.last_reviewed_at IS NULL OR review_record.last_reviewed_at <= :lastReviewedAt";

    private static final String DELETE_REVIEW_RECORD_SQL =
            "DELETE FROM review_record WHERE owner_id = :ownerId AND item_id = :itemId";

    private static final String GET_REVIEW_RECORDS_UPDATED_SINCE_SQL =
            "SELECT " + REVIEW_RECORD_COLUMNS +
            "FROM review_record " +
            "WHERE owner_id = :ownerId AND update_instant > :since " +
            "ORDER BY update_instant";

    private final NamedParameterJdbcTemplate template;

    public ReviewRecordDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<ReviewRecord> getReviewRecords(String ownerId) {
        try {
            return template.query(GET_REVIEW_RECORDS_SQL, Map.of("ownerId", ownerId),
                    (rs, rowNum) -> getDBReviewRecordFromResultSet(rs, rowNum).toReviewRecord());
        } catch (DataAccessException ex) {
            throw new DaoException("Failed to load review records for " + ownerId, ex);
        }
    }

    @Override
    public int saveReviewRecord(ReviewRecord reviewRecord) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ownerId", reviewRecord.ownerId())
                .addValue("itemId", reviewRecord.itemId())
                .addValue("dueAt", Timestamp.from(reviewRecord.dueAt()))
                .addValue("easeFactor", BigDecimal.valueOf(reviewRecord.easeFactor()).setScale(2, RoundingMode.HALF_UP))
                .addValue("intervalDays", reviewRecord.intervalDays())
                .addValue("repetitionCount", reviewRecord.repetitionCount())
                .addValue("lastGrade", reviewRecord.lastGrade() == null ? null : reviewRecord.lastGrade().name())
                .addValue("lastReviewedAt", toTimestamp(reviewRecord.lastReviewedAt()));

        try {
            int rowsUpdated = template.update(SAVE_REVIEW_RECORD_SQL, params);
            if (rowsUpdated == 0) {
                log.info("Stored review record for item {} of {} is newer than the one being saved. Skipped.",
                        reviewRecord.itemId(), reviewRecord.ownerId());
            }

            return rowsUpdated;
        } catch (DataAccessException ex) {
            throw new DaoException("Failed to save review record for item " + reviewRecord.itemId(), ex);
        }
    }

    @Override
    public int deleteReviewRecord(String ownerId, String itemId) {
        try {
            return template.update(DELETE_REVIEW_RECORD_SQL, Map.of(
                    "ownerId", ownerId,
                    "itemId", itemId));
        } catch (DataAccessException ex) {
            throw new DaoException("Failed to delete review record for item " + itemId, ex);
        }
    }

    @Override
    public List<DBReviewRecord> getReviewRecordsUpdatedSince(String ownerId, Instant since) {
        try {
            return template.query(GET_REVIEW_RECORDS_UPDATED_SINCE_SQL, Map.of(
                            "ownerId", ownerId,
                            "since", Timestamp.from(since)),
                    ReviewRecordDaoPG::getDBReviewRecordFromResultSet);
        } catch (DataAccessException ex) {
            throw new DaoException("Failed to load updated review records for " + ownerId, ex);
        }
    }

    private static DBReviewRecord getDBReviewRecordFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new DBReviewRecord(
                rs.getString("owner_id"),
                rs.getString("item_id"),
                toInstant(rs.getTimestamp("due_at")),
                rs.getDouble("ease_factor"),
                rs.getInt("interval_days"),
                rs.getInt("repetition_count"),
                Grade.fromName(rs.getString("last_grade")),
                toInstant(rs.getTimestamp("last_reviewed_at")),
                toInstant(rs.getTimestamp("update_instant")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
