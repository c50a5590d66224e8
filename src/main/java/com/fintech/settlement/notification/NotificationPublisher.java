package com.fintech.settlement.notification;

import com.fintech.settlement.dto.SubscriptionNotification;

/**
 * Outbound seam for subscriber-facing notifications. Implementations must not throw for
 * delivery problems; billing state has already been committed when they are called.
 */
public interface NotificationPublisher {

    void publish(SubscriptionNotification notification);
}
