package com.fintech.settlement.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.settlement.dto.InitiationRequest;
import com.fintech.settlement.dto.NormalizedEvent;
import com.fintech.settlement.dto.ProviderOutcome;
import com.fintech.settlement.dto.ProviderReference;
import com.fintech.settlement.exception.MalformedCallbackException;
import com.fintech.settlement.exception.ProviderRejectedException;
import com.fintech.settlement.exception.ProviderUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Airtel Money Collect API integration.
 * <p>
 * Transaction status codes: TS successful, TF failed, TIP/TA still in progress.
 */
@Component
@ConditionalOnProperty(prefix = "settlement.providers.airtel", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class AirtelProviderAdapter extends AbstractHttpProviderAdapter {

    public static final String PROVIDER_NAME = "airtel";

    static final String DEFAULT_BASE_URL = "https://openapiuat.airtel.africa";
    static final String TOKEN_PATH = "/auth/oauth2/token";
    static final String COLLECT_PATH = "/merchant/v1/payments/";
    static final String QUERY_PATH = "/standard/v1/payments/";
    static final String REFUND_PATH = "/standard/v1/payments/refund";

    private static final Set<String> SUCCESS_CODES = Set.of("TS", "SUCCESS");
    private static final Set<String> FAILURE_CODES = Set.of("TF", "FAILED");
    private static final String DEFAULT_COUNTRY = "KE";

    /**
     * Tokens are refreshed five minutes before the expiry Airtel announces.
     */
    private static final Duration TOKEN_SAFETY_MARGIN = Duration.ofMinutes(5);

    public AirtelProviderAdapter(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 ProviderCredentialsSource credentialsSource,
                                 Clock clock) {
        super(restTemplate, objectMapper, credentialsSource, clock);
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public CollectionMode collectionMode() {
        return CollectionMode.DIRECT_COLLECT;
    }

    @Override
    @CircuitBreaker(name = PROVIDER_NAME, fallbackMethod = "initiateFallback")
    @Retryable(
            retryFor = ProviderUnavailableException.class,
            maxAttemptsExpression = "${settlement.http.retry-max-attempts:3}",
            backoff = @Backoff(delayExpression = "${settlement.http.retry-delay-ms:1000}", multiplier = 2)
    )
    public ProviderReference initiate(InitiationRequest request) {
        ProviderCredentials credentials = credentials(request.getTenantId());
        String country = country(credentials);
        String transactionId = transactionId(request);

        Map<String, Object> subscriber = new LinkedHashMap<>();
        subscriber.put("country", country);
        subscriber.put("currency", credentials.getCurrency());
        subscriber.put("msisdn", localMsisdn(request.getPayerAccount()));

        Map<String, Object> transaction = new LinkedHashMap<>();
        transaction.put("amount", toMajorUnits(request.getAmount()));
        transaction.put("country", country);
        transaction.put("currency", credentials.getCurrency());
        transaction.put("id", transactionId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reference", request.getAccountReference() != null ? request.getAccountReference() : transactionId);
        body.put("subscriber", subscriber);
        body.put("transaction", transaction);

        log.info("Initiating Airtel collect: tenant={}, intentId={}, transactionId={}, amount={}",
                request.getTenantId(), request.getIntentId(), transactionId, request.getAmount());

        JsonNode response = exchange(request.getTenantId(), "initiate", HttpMethod.POST,
                url(credentials, COLLECT_PATH), headers(request.getTenantId(), credentials), body);

        JsonNode status = response.path("status");
        if (!status.path("success").asBoolean(false)) {
            throw new ProviderRejectedException("Airtel collect rejected: " + text(status, "message"),
                    PROVIDER_NAME, text(status, "response_code"));
        }

        String reference = text(response.path("data").path("transaction"), "id");
        return ProviderReference.builder()
                .provider(PROVIDER_NAME)
                .reference(reference != null ? reference : transactionId)
                .build();
    }

    public ProviderReference initiateFallback(InitiationRequest request, CallNotPermittedException e) {
        throw circuitOpen("initiate", e);
    }

    @Override
    public NormalizedEvent parseCallback(String rawPayload) {
        JsonNode root = readCallback(rawPayload);
        JsonNode transaction = root.path("transaction");
        if (!transaction.isObject()) {
            throw new MalformedCallbackException("Missing transaction object", PROVIDER_NAME);
        }

        String transactionId = text(transaction, "id");
        String statusCode = text(transaction, "status_code") != null
                ? text(transaction, "status_code") : text(transaction, "status");
        if (transactionId == null || statusCode == null) {
            throw new MalformedCallbackException("Missing transaction id or status", PROVIDER_NAME);
        }

        String airtelMoneyId = text(transaction, "airtel_money_id");
        NormalizedEvent.NormalizedEventBuilder event = NormalizedEvent.builder()
                .provider(PROVIDER_NAME)
                .providerEventId(airtelMoneyId != null ? airtelMoneyId : transactionId + ":" + statusCode)
                .providerReference(transactionId)
                .receiptNumber(airtelMoneyId);

        if (SUCCESS_CODES.contains(statusCode)) {
            return event
                    .outcome(ProviderOutcome.SUCCESS)
                    .amount(transaction.has("amount") ? toMinorUnits(transaction.get("amount")) : null)
                    .build();
        }
        if (FAILURE_CODES.contains(statusCode)) {
            return event
                    .outcome(ProviderOutcome.FAILURE)
                    .failureReason(statusCode + ": " + text(transaction, "message"))
                    .build();
        }
        throw new MalformedCallbackException("Callback with non-final status " + statusCode, PROVIDER_NAME);
    }

    @Override
    @CircuitBreaker(name = PROVIDER_NAME, fallbackMethod = "queryStatusFallback")
    @Retryable(
            retryFor = ProviderUnavailableException.class,
            maxAttemptsExpression = "${settlement.http.retry-max-attempts:3}",
            backoff = @Backoff(delayExpression = "${settlement.http.retry-delay-ms:1000}", multiplier = 2)
    )
    public ProviderOutcome queryStatus(String tenantId, String providerReference) {
        ProviderCredentials credentials = credentials(tenantId);
        JsonNode response;
        try {
            response = exchange(tenantId, "queryStatus", HttpMethod.GET,
                    url(credentials, QUERY_PATH) + providerReference, headers(tenantId, credentials), null);
        } catch (ProviderRejectedException e) {
            if ("404".equals(e.getProviderCode())) {
                return ProviderOutcome.NOT_FOUND;
            }
            throw e;
        }

        String status = text(response.path("data").path("transaction"), "status");
        if (status == null) {
            return ProviderOutcome.NOT_FOUND;
        }
        if (SUCCESS_CODES.contains(status)) {
            return ProviderOutcome.SUCCESS;
        }
        if (FAILURE_CODES.contains(status)) {
            return ProviderOutcome.FAILURE;
        }
        return ProviderOutcome.PENDING;
    }

    public ProviderOutcome queryStatusFallback(String tenantId, String providerReference, CallNotPermittedException e) {
        throw circuitOpen("queryStatus", e);
    }

    @Override
    @CircuitBreaker(name = PROVIDER_NAME, fallbackMethod = "reverseFallback")
    @Retryable(
            retryFor = ProviderUnavailableException.class,
            maxAttemptsExpression = "${settlement.http.retry-max-attempts:3}",
            backoff = @Backoff(delayExpression = "${settlement.http.retry-delay-ms:1000}", multiplier = 2)
    )
    public ProviderOutcome reverse(String tenantId, String providerTransactionId, long amount) {
        ProviderCredentials credentials = credentials(tenantId);
        String country = country(credentials);

        Map<String, Object> transaction = new LinkedHashMap<>();
        transaction.put("airtel_money_id", providerTransactionId);
        transaction.put("amount", toMajorUnits(amount));
        transaction.put("country", country);
        transaction.put("currency", credentials.getCurrency());

        JsonNode response = exchange(tenantId, "reverse", HttpMethod.POST,
                url(credentials, REFUND_PATH), headers(tenantId, credentials), Map.of("transaction", transaction));

        JsonNode status = response.path("status");
        if (!status.path("success").asBoolean(false)) {
            throw new ProviderRejectedException("Airtel refund rejected: " + text(status, "message"),
                    PROVIDER_NAME, text(status, "response_code"));
        }
        String refundStatus = text(response.path("data").path("transaction"), "status");
        log.info("Airtel refund accepted: tenant={}, airtelMoneyId={}, status={}",
                tenantId, providerTransactionId, refundStatus);
        return SUCCESS_CODES.contains(refundStatus) ? ProviderOutcome.SUCCESS : ProviderOutcome.PENDING;
    }

    public ProviderOutcome reverseFallback(String tenantId, String providerTransactionId, long amount,
                                           CallNotPermittedException e) {
        throw circuitOpen("reverse", e);
    }

    @Override
    public Map<String, Object> acknowledgement() {
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("status", "OK");
        return ack;
    }

    @Override
    protected TokenGrant requestToken(String tenantId, ProviderCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("client_id", credentials.getClientId());
        body.put("client_secret", credentials.getClientSecret());
        body.put("grant_type", "client_credentials");

        JsonNode response = exchange(tenantId, "authenticate", HttpMethod.POST,
                url(credentials, TOKEN_PATH), headers, body);
        String token = text(response, "access_token");
        if (token == null) {
            throw new ProviderUnavailableException("Airtel token response without access_token", PROVIDER_NAME);
        }
        Duration expiresIn = Duration.ofSeconds(response.path("expires_in").asLong(3600));
        Duration validFor = expiresIn.compareTo(TOKEN_SAFETY_MARGIN.multipliedBy(2)) > 0
                ? expiresIn.minus(TOKEN_SAFETY_MARGIN)
                : expiresIn.dividedBy(2);
        return new TokenGrant(token, validFor);
    }

    private HttpHeaders headers(String tenantId, ProviderCredentials credentials) {
        HttpHeaders headers = bearerHeaders(tenantId, credentials);
        headers.set("X-Country", country(credentials));
        headers.set("X-Currency", credentials.getCurrency());
        return headers;
    }

    /**
     * Airtel expects the id we assign; it is derived from the intent so a retried request is recognisable.
     */
    static String transactionId(InitiationRequest request) {
        return "PI" + request.getIntentId();
    }

    /**
     * Airtel takes the MSISDN without the country code: 254712345678 becomes 0712345678.
     */
    static String localMsisdn(String msisdn) {
        if (msisdn == null || msisdn.isBlank()) {
            throw new ProviderRejectedException("Payer MSISDN is required", PROVIDER_NAME, "INVALID_MSISDN");
        }
        String digits = msisdn.trim();
        if (digits.startsWith("+254")) {
            return "0" + digits.substring(4);
        }
        if (digits.startsWith("254")) {
            return "0" + digits.substring(3);
        }
        return digits;
    }

    private static String country(ProviderCredentials credentials) {
        return credentials.getCountry() != null ? credentials.getCountry() : DEFAULT_COUNTRY;
    }

    private static String url(ProviderCredentials credentials, String path) {
        String base = credentials.getBaseUrl() != null ? credentials.getBaseUrl() : DEFAULT_BASE_URL;
        return trimTrailingSlash(base) + path;
    }
}
