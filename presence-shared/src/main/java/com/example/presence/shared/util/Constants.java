package com.example.presence.shared.util;

public final class Constants {

    private Constants() {}

    public static final String DLT_SUFFIX = "-dlt";
    public static final String CORRELATION_ID_KEY = "correlation_id";
    public static final String REGISTRY_AGGREGATE = "channel_connection";

    public enum ConnectionStatus {
        CONNECTED,
        DISCONNECTING
    }

    public enum MutationType {
        CREATED,
        REMOVED,
        MODIFIED
    }

    public enum DeliveryState {
        PENDING,
        DELIVERED,
        FAILED,
        DEAD_LETTERED
    }

    public enum NotificationChannel {
        IN_APP,
        EMAIL,
        PUSH
    }

    public enum NotificationStatus {
        PENDING,
        SENT,
        DELIVERED,
        READ,
        DISMISSED,
        EXPIRED,
        FAILED
    }

    /**
     * Outbound envelope types, serialized by their wire name.
     */
    public enum OutboundType {
        CONNECTION_CONFIRMED("connectionConfirmed"),
        CHAT_MESSAGE("chatMessage"),
        MESSAGE_CONFIRMATION("messageConfirmation"),
        USER_JOINED("userJoined"),
        USER_LEFT("userLeft"),
        USER_ONLINE("userOnline"),
        USER_OFFLINE("userOffline"),
        ROOM_JOINED("roomJoined"),
        ROOM_LEFT("roomLeft"),
        LIVE_UPDATE("liveUpdate"),
        UPDATE_CONFIRMATION("updateConfirmation"),
        NOTIFICATION("notification"),
        ERROR("error");

        private final String wireName;

        OutboundType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }
}
