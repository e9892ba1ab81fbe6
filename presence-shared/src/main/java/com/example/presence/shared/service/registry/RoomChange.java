package com.example.presence.shared.service.registry;

import com.example.presence.shared.model.ChannelConnection;

import java.util.Objects;

/**
 * Before and after images of a connection whose room fields were written.
 */
public record RoomChange(ChannelConnection before, ChannelConnection after) {

    public String previousRoomId() {
        return before.getRoomId();
    }

    public String currentRoomId() {
        return after.getRoomId();
    }

    public boolean roomChanged() {
        return !Objects.equals(previousRoomId(), currentRoomId());
    }

    public boolean isNoOp() {
        return before == after;
    }
}
