package com.vestpod.alert.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Default sink when no push provider is wired: the notification is written to the log.
 */
@Slf4j
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public boolean send(String userId, String title, String body, String correlationId) {
        log.info("[PUSH NOTIFICATION] user={} alert={} title=\"{}\" body=\"{}\"", userId, correlationId, title, body);
        return true;
    }
}
