package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of handling one inbound callback, independent of HTTP framing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResult {

    private WebhookOutcome outcome;

    /**
     * Always true: every callback, including malformed ones and replays, is acknowledged.
     */
    @Builder.Default
    private boolean ackRequired = true;

    /**
     * Provider-specific acknowledgement body.
     */
    private Map<String, Object> acknowledgement;

    private Long intentId;

    /**
     * Recorded status of the intent after handling, e.g. SUCCEEDED.
     */
    private String result;
}
