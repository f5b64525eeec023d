package com.vestpod.alert;

import com.vestpod.alert.notification.LoggingNotificationSender;
import com.vestpod.alert.notification.NotificationSender;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Alert module beans. A real push integration replaces the logging sender by declaring its own NotificationSender.
 */
@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class AlertConfig {

    @Bean
    public AlertConditionEvaluator alertConditionEvaluator(AlertProperties properties) {
        return new AlertConditionEvaluator(properties.getMaturityZone());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationSender.class)
    public NotificationSender notificationSender() {
        return new LoggingNotificationSender();
    }
}
