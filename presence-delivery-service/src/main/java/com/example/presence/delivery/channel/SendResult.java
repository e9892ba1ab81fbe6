package com.example.presence.delivery.channel;

/**
 * Outcome of one send through a channel. {@code error} is set only when not delivered.
 */
public record SendResult(boolean delivered, String error) {

    public static SendResult ok() {
        return new SendResult(true, null);
    }

    public static SendResult failed(String error) {
        return new SendResult(false, error);
    }
}
