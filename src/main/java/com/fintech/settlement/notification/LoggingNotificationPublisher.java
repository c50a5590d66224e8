package com.fintech.settlement.notification;

import com.fintech.settlement.dto.SubscriptionNotification;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default publisher: writes each notification to the log and counts it by kind.
 */
@Component
@Slf4j
public class LoggingNotificationPublisher implements NotificationPublisher {

    private final MeterRegistry meterRegistry;

    public LoggingNotificationPublisher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void publish(SubscriptionNotification notification) {
        meterRegistry.counter("subscription.notifications", "kind", notification.getKind().name()).increment();
        log.info("Notification {}: tenant={}, subject={}, subscription={}, amount={} {}, attempt={}",
                notification.getKind(), notification.getTenantId(), notification.getSubjectId(),
                notification.getSubscriptionId(), notification.getAmount(), notification.getCurrency(),
                notification.getAttemptNumber());
    }
}
