package com.example.presence.shared.repository;

import com.example.presence.shared.model.ChannelConnection;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ChannelConnectionRepository extends CrudRepository<ChannelConnection, String> {

    // Derived Queries
    List<ChannelConnection> findByUserId(String userId);
    List<ChannelConnection> findByRoomId(String roomId);

    /**
     * Create-only-if-absent. Returns 0 when the id is already registered; the existing row is left untouched.
     */
    @Modifying
    @Query("""
        INSERT INTO channel_connections
            (id, user_id, pod_name, status, connected_at, last_activity_at, expires_at, metadata)
        VALUES
            (:id, :userId, :podName, 'CONNECTED', :now, :now, :expiresAt, :metadata)
        ON CONFLICT (id) DO NOTHING
    """)
    int insertIfAbsent(@Param("id") String id,
                       @Param("userId") String userId,
                       @Param("podName") String podName,
                       @Param("now") OffsetDateTime now,
                       @Param("expiresAt") OffsetDateTime expiresAt,
                       @Param("metadata") String metadata);

    @Query("SELECT * FROM channel_connections WHERE id = :id FOR UPDATE")
    Optional<ChannelConnection> findByIdForUpdate(@Param("id") String id);

    @Modifying
    @Query("UPDATE channel_connections SET last_activity_at = :now, expires_at = :expiresAt WHERE id = :id")
    int touch(@Param("id") String id, @Param("now") OffsetDateTime now, @Param("expiresAt") OffsetDateTime expiresAt);

    @Modifying
    @Query("UPDATE channel_connections SET last_activity_at = :now, expires_at = :expiresAt WHERE id IN (:ids)")
    int touchAll(@Param("ids") Collection<String> ids, @Param("now") OffsetDateTime now, @Param("expiresAt") OffsetDateTime expiresAt);

    @Modifying
    @Query("""
        UPDATE channel_connections
        SET room_id = :roomId, room_type = :roomType, room_joined_at = :now, last_activity_at = :now
        WHERE id = :id
    """)
    int updateRoom(@Param("id") String id,
                   @Param("roomId") String roomId,
                   @Param("roomType") String roomType,
                   @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE channel_connections
        SET room_id = NULL, room_type = NULL, room_joined_at = NULL, last_activity_at = :now
        WHERE id = :id AND room_id IS NOT NULL
    """)
    int clearRoom(@Param("id") String id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("DELETE FROM channel_connections WHERE id = :id")
    int deleteConnection(@Param("id") String id);

    @Query("SELECT id FROM channel_connections WHERE expires_at <= :now ORDER BY expires_at LIMIT :limit")
    List<String> findExpiredIds(@Param("now") OffsetDateTime now, @Param("limit") int limit);

    @Query("SELECT COUNT(DISTINCT user_id) FROM channel_connections")
    long countDistinctUsers();

    @Query("SELECT COUNT(DISTINCT room_id) FROM channel_connections WHERE room_id IS NOT NULL")
    long countActiveRooms();

    long countByPodName(String podName);
}
