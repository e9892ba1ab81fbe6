package com.example.presence.shared.repository;

import com.example.presence.shared.model.Notification;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface NotificationRepository extends CrudRepository<Notification, String> {

    @Modifying
    @Query("""
        INSERT INTO notifications (id, user_id, title, body, type, status, created_at, updated_at, expires_at)
        VALUES (:id, :userId, :title, :body, :type, 'PENDING', :now, :now, :expiresAt)
        ON CONFLICT (id) DO NOTHING
    """)
    int insertIfAbsent(@Param("id") String id,
                       @Param("userId") String userId,
                       @Param("title") String title,
                       @Param("body") String body,
                       @Param("type") String type,
                       @Param("expiresAt") OffsetDateTime expiresAt,
                       @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE notifications SET status = :status, updated_at = :now
        WHERE id = :id AND status IN ('PENDING', 'SENT')
    """)
    int updateStatusIfOpen(@Param("id") String id, @Param("status") String status, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE notifications SET status = 'PENDING', updated_at = :now WHERE id = :id AND status = 'FAILED'")
    int reopenFailed(@Param("id") String id, @Param("now") OffsetDateTime now);

    @Query("""
        SELECT id FROM notifications
        WHERE expires_at <= :now AND status NOT IN ('EXPIRED', 'READ', 'DISMISSED')
    """)
    List<String> findIdsToExpire(@Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE notifications SET status = 'EXPIRED', updated_at = :now WHERE id IN (:ids)")
    int markExpired(@Param("ids") Collection<String> ids, @Param("now") OffsetDateTime now);

    @Query("SELECT id FROM notifications WHERE status = 'EXPIRED' AND expires_at < :cutoff")
    List<String> findExpiredIdsBefore(@Param("cutoff") OffsetDateTime cutoff);

    @Query("SELECT id FROM notifications WHERE status IN ('READ', 'DISMISSED') AND updated_at < :cutoff")
    List<String> findReadOrDismissedIdsBefore(@Param("cutoff") OffsetDateTime cutoff);
}
