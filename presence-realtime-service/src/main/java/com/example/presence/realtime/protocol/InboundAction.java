package com.example.presence.realtime.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum InboundAction {
    SEND_MESSAGE("sendMessage"),
    JOIN_ROOM("joinRoom"),
    LEAVE_ROOM("leaveRoom"),
    UPDATE_STATUS("updateStatus");

    private final String wireName;

    InboundAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<InboundAction> fromWire(String action) {
        return Arrays.stream(values()).filter(a -> a.wireName.equals(action)).findFirst();
    }

    public static List<String> validActions() {
        return Arrays.stream(values()).map(InboundAction::wireName).toList();
    }
}
