package com.example.presence.shared.repository;

import com.example.presence.shared.model.NotificationDeliveryRecord;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * State writes are conditional on the expected state and attempt count, so a stale
 * or repeated attempt never overwrites a newer outcome.
 */
@Repository
public interface NotificationDeliveryRepository extends CrudRepository<NotificationDeliveryRecord, String> {

    List<NotificationDeliveryRecord> findByState(String state);

    @Modifying
    @Query("""
        INSERT INTO notification_deliveries
            (notification_id, channel, recipient, attempt_count, state, next_retry_at, first_dispatched_at, payload)
        VALUES
            (:notificationId, :channel, :recipient, 0, 'PENDING', :now, :now, :payload)
        ON CONFLICT (notification_id) DO NOTHING
    """)
    int insertIfAbsent(@Param("notificationId") String notificationId,
                       @Param("channel") String channel,
                       @Param("recipient") String recipient,
                       @Param("payload") String payload,
                       @Param("now") OffsetDateTime now);

    @Query("""
        SELECT * FROM notification_deliveries
        WHERE state = 'PENDING' AND next_retry_at <= :now
        ORDER BY next_retry_at
        LIMIT :limit
    """)
    List<NotificationDeliveryRecord> findDue(@Param("now") OffsetDateTime now, @Param("limit") int limit);

    @Modifying
    @Query("""
        UPDATE notification_deliveries
        SET state = 'DELIVERED', attempt_count = :expectedAttempts + 1, last_attempt_at = :now,
            delivered_at = :now, next_retry_at = NULL, last_error = NULL
        WHERE notification_id = :id AND state = 'PENDING' AND attempt_count = :expectedAttempts
    """)
    int markDelivered(@Param("id") String id,
                      @Param("expectedAttempts") int expectedAttempts,
                      @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE notification_deliveries
        SET attempt_count = :expectedAttempts + 1, last_attempt_at = :now,
            next_retry_at = :nextRetryAt, last_error = :error
        WHERE notification_id = :id AND state = 'PENDING' AND attempt_count = :expectedAttempts
    """)
    int markRetry(@Param("id") String id,
                  @Param("expectedAttempts") int expectedAttempts,
                  @Param("nextRetryAt") OffsetDateTime nextRetryAt,
                  @Param("error") String error,
                  @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE notification_deliveries
        SET state = 'DEAD_LETTERED', attempt_count = :newAttemptCount, dead_lettered_at = :now,
            next_retry_at = NULL, last_error = :error
        WHERE notification_id = :id AND state = 'PENDING' AND attempt_count = :expectedAttempts
    """)
    int markDeadLettered(@Param("id") String id,
                         @Param("expectedAttempts") int expectedAttempts,
                         @Param("newAttemptCount") int newAttemptCount,
                         @Param("error") String error,
                         @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE notification_deliveries
        SET state = 'FAILED', last_attempt_at = :now, next_retry_at = NULL, last_error = :error
        WHERE notification_id = :id AND state = 'PENDING' AND attempt_count = :expectedAttempts
    """)
    int markFailed(@Param("id") String id,
                   @Param("expectedAttempts") int expectedAttempts,
                   @Param("error") String error,
                   @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE notification_deliveries
        SET state = 'PENDING', attempt_count = 0, next_retry_at = :now, first_dispatched_at = :now,
            last_error = NULL, dead_lettered_at = NULL
        WHERE notification_id = :id AND state = 'DEAD_LETTERED'
    """)
    int redrive(@Param("id") String id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("DELETE FROM notification_deliveries WHERE notification_id = :id AND state = 'DEAD_LETTERED'")
    int deleteDeadLettered(@Param("id") String id);

    @Query("""
        SELECT notification_id FROM notification_deliveries
        WHERE COALESCE(last_attempt_at, first_dispatched_at) < :cutoff
    """)
    List<String> findIdsLastActiveBefore(@Param("cutoff") OffsetDateTime cutoff);

    @Query("""
        SELECT d.notification_id FROM notification_deliveries d
        WHERE NOT EXISTS (SELECT 1 FROM notifications n WHERE n.id = d.notification_id)
    """)
    List<String> findOrphanedIds();

    @Query("""
        SELECT * FROM notification_deliveries
        WHERE COALESCE(last_attempt_at, first_dispatched_at) >= :from
          AND COALESCE(last_attempt_at, first_dispatched_at) < :to
    """)
    List<NotificationDeliveryRecord> findActiveBetween(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);
}
