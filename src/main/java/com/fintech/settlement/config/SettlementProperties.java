package com.fintech.settlement.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settlement policy: currency, time windows, dunning cadence, tax hook and provider endpoints.
 */
@Component
@ConfigurationProperties(prefix = "settlement")
@Validated
@Data
public class SettlementProperties {

    /**
     * The single accepted currency. Amounts are minor units of it.
     */
    private String currency = "KES";

    /**
     * How long a PROVIDER_INITIATED intent waits for its callback before the expiry sweep queries the provider.
     */
    private Duration callbackTimeout = Duration.ofMinutes(10);

    /**
     * Lifetime of an intent that was never initiated.
     */
    private Duration intentTtl = Duration.ofHours(1);

    /**
     * Lease of an IN_FLIGHT idempotency reservation. Past it, the reservation is assumed abandoned.
     */
    private Duration idempotencyLease = Duration.ofMinutes(5);

    /**
     * Public base URL providers post callbacks to; the provider name is appended.
     */
    private String callbackBaseUrl = "http://localhost:8080/api/v1/webhooks";

    private Dunning dunning = new Dunning();

    @Valid
    private Tax tax = new Tax();

    private Http http = new Http();

    /**
     * Default credentials and endpoints, keyed by provider name.
     */
    private Map<String, ProviderSettings> providers = new HashMap<>();

    /**
     * Per-tenant overrides, keyed by tenant id then provider name.
     */
    private Map<String, Map<String, ProviderSettings>> tenants = new HashMap<>();

    @Data
    public static class Dunning {

        /**
         * Retry offsets in days relative to the failed renewal.
         */
        private List<Integer> attemptOffsetsDays = new ArrayList<>(List.of(0, 1, 3));

        private int graceDays = 7;
    }

    @Data
    public static class Tax {

        /**
         * Flat rate taken out of each settled amount, e.g. 0.16. Zero disables the tax line.
         * Must be at least 0 and below 1; the application does not start otherwise.
         */
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private BigDecimal rate = BigDecimal.ZERO;
    }

    @Data
    public static class Http {

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);

        /**
         * Attempts per provider call, including the first, for retryable failures.
         */
        private int retryMaxAttempts = 3;

        /**
         * First retry delay; doubles on each further attempt.
         */
        private long retryDelayMs = 1000;
    }

    @Data
    public static class ProviderSettings {

        private boolean enabled = true;
        private String baseUrl;
        private String clientId;
        private String clientSecret;
        private String shortcode;
        private String passkey;
        private String transactionType;
        private String initiator;
        private String securityCredential;
        private String country;
        private String currency;
    }
}
