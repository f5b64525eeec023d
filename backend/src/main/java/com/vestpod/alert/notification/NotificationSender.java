package com.vestpod.alert.notification;

/**
 * Push channel to a user's devices. Fire-and-forget: implementations report failure through the return
 * value and must not throw for delivery problems.
 */
public interface NotificationSender {

    /**
     * @param correlationId id of the alert that caused the notification
     * @return true when the notification was handed to the channel
     */
    boolean send(String userId, String title, String body, String correlationId);
}
