package com.example.presence.shared.repository;

import com.example.presence.shared.model.ChatMessage;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface ChatMessageRepository extends CrudRepository<ChatMessage, String> {

    @Query("SELECT * FROM chat_messages WHERE room_id = :roomId ORDER BY created_at DESC LIMIT :limit")
    List<ChatMessage> findRecentByRoomId(@Param("roomId") String roomId, @Param("limit") int limit);

    @Query("SELECT id FROM chat_messages WHERE expires_at <= :now ORDER BY expires_at LIMIT :limit")
    List<String> findExpiredIds(@Param("now") OffsetDateTime now, @Param("limit") int limit);
}
