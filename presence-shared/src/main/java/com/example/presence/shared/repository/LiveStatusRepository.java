package com.example.presence.shared.repository;

import com.example.presence.shared.model.LiveStatusRecord;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface LiveStatusRepository extends CrudRepository<LiveStatusRecord, String> {

    /**
     * Latest write wins: an existing record for the same resource is overwritten in place.
     */
    @Modifying
    @Query("""
        INSERT INTO live_status_records
            (status_key, resource_type, resource_id, status, progress, metadata, updated_by, updated_at, expires_at)
        VALUES
            (:statusKey, :resourceType, :resourceId, :status, :progress, :metadata, :updatedBy, :updatedAt, :expiresAt)
        ON CONFLICT (status_key) DO UPDATE SET
            status = EXCLUDED.status,
            progress = EXCLUDED.progress,
            metadata = EXCLUDED.metadata,
            updated_by = EXCLUDED.updated_by,
            updated_at = EXCLUDED.updated_at,
            expires_at = EXCLUDED.expires_at
    """)
    int upsert(@Param("statusKey") String statusKey,
               @Param("resourceType") String resourceType,
               @Param("resourceId") String resourceId,
               @Param("status") String status,
               @Param("progress") Integer progress,
               @Param("metadata") String metadata,
               @Param("updatedBy") String updatedBy,
               @Param("updatedAt") OffsetDateTime updatedAt,
               @Param("expiresAt") OffsetDateTime expiresAt);

    @Query("SELECT status_key FROM live_status_records WHERE expires_at <= :now ORDER BY expires_at LIMIT :limit")
    List<String> findExpiredKeys(@Param("now") OffsetDateTime now, @Param("limit") int limit);
}
