package com.example.presence.shared.repository;

import com.example.presence.shared.model.RegistryOutboxEvent;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Rows are read in insertion order ({@code seq}) so per-user mutation order survives publishing.
 */
@Repository
public interface RegistryOutboxRepository extends CrudRepository<RegistryOutboxEvent, UUID> {

    @Query("""
        SELECT * FROM registry_outbox
        ORDER BY seq
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
    """)
    List<RegistryOutboxEvent> findAndLockUnprocessedEvents(@Param("limit") int limit);
}
