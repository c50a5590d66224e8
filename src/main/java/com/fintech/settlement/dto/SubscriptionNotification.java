package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transition event handed to the notification collaborator. Delivery, templating and
 * quiet hours are that collaborator's concern.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionNotification {

    private String tenantId;
    private String subjectId;
    private Long subscriptionId;
    private NotificationKind kind;
    private long amount;
    private String currency;

    /**
     * Dunning attempt number, when the notification concerns one.
     */
    private Integer attemptNumber;

    private Instant occurredAt;
}
