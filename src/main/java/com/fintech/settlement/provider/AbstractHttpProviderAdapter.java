package com.fintech.settlement.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.settlement.exception.MalformedCallbackException;
import com.fintech.settlement.exception.ProviderRejectedException;
import com.fintech.settlement.exception.ProviderUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared plumbing for providers reached over HTTP: bearer token caching per tenant, JSON
 * exchange and translation of transport errors into the provider exception types.
 * <p>
 * Error mapping:
 * - connection failures, timeouts, 5xx and 429: {@link ProviderUnavailableException}
 * - 401: cached token evicted, then {@link ProviderUnavailableException} so a retry re-authenticates
 * - other 4xx: {@link ProviderRejectedException}
 */
@Slf4j
public abstract class AbstractHttpProviderAdapter implements PaymentProviderAdapter {

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;
    protected final ProviderCredentialsSource credentialsSource;
    protected final Clock clock;

    private final Map<String, CachedToken> tokenCache = new ConcurrentHashMap<>();

    protected AbstractHttpProviderAdapter(RestTemplate restTemplate,
                                          ObjectMapper objectMapper,
                                          ProviderCredentialsSource credentialsSource,
                                          Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.credentialsSource = credentialsSource;
        this.clock = clock;
    }

    /**
     * Fetches a new access token from the provider.
     */
    protected abstract TokenGrant requestToken(String tenantId, ProviderCredentials credentials);

    protected ProviderCredentials credentials(String tenantId) {
        return credentialsSource.credentialsFor(tenantId, getProviderName());
    }

    protected String accessToken(String tenantId, ProviderCredentials credentials) {
        Instant now = clock.instant();
        CachedToken cached = tokenCache.get(tenantId);
        if (cached != null && now.isBefore(cached.getExpiresAt())) {
            return cached.getToken();
        }

        TokenGrant grant = requestToken(tenantId, credentials);
        tokenCache.put(tenantId, new CachedToken(grant.getToken(), now.plus(grant.getValidFor())));
        log.info("Obtained {} access token for tenant={}, valid for {}", getProviderName(), tenantId, grant.getValidFor());
        return grant.getToken();
    }

    protected HttpHeaders bearerHeaders(String tenantId, ProviderCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(accessToken(tenantId, credentials));
        return headers;
    }

    /**
     * Performs the call and returns the parsed body. Any non-2xx answer is translated.
     */
    protected JsonNode exchange(String tenantId, String operation, HttpMethod method, String url,
                                HttpHeaders headers, Object body) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
            return parseResponse(operation, response.getBody());
        } catch (HttpStatusCodeException e) {
            throw translate(tenantId, operation, e);
        } catch (ResourceAccessException e) {
            throw new ProviderUnavailableException(
                    getProviderName() + " " + operation + " failed: " + e.getMessage(), getProviderName(), e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(
                    getProviderName() + " " + operation + " returned an unreadable response", getProviderName(), e);
        }
    }

    /**
     * Like {@link #exchange} but hands back the error body of a non-2xx answer when it carries one,
     * for APIs that report business states (e.g. "still processing") through error statuses.
     */
    protected JsonNode exchangeAllowingErrorBody(String tenantId, String operation, HttpMethod method, String url,
                                                 HttpHeaders headers, Object body) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
            return parseResponse(operation, response.getBody());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
                String errorBody = e.getResponseBodyAsString();
                if (!errorBody.isBlank()) {
                    try {
                        return objectMapper.readTree(errorBody);
                    } catch (JsonProcessingException parseError) {
                        log.debug("{} {} error body is not JSON: {}", getProviderName(), operation, errorBody);
                    }
                }
            }
            throw translate(tenantId, operation, e);
        } catch (ResourceAccessException e) {
            throw new ProviderUnavailableException(
                    getProviderName() + " " + operation + " failed: " + e.getMessage(), getProviderName(), e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(
                    getProviderName() + " " + operation + " returned an unreadable response", getProviderName(), e);
        }
    }

    private JsonNode parseResponse(String operation, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(
                    getProviderName() + " " + operation + " returned invalid JSON", getProviderName(), e);
        }
    }

    private RuntimeException translate(String tenantId, String operation, HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        log.warn("{} {} failed for tenant={}: status={}, body={}",
                getProviderName(), operation, tenantId, status, e.getResponseBodyAsString());

        if (status == HttpStatus.UNAUTHORIZED.value()) {
            tokenCache.remove(tenantId);
            return new ProviderUnavailableException(
                    getProviderName() + " rejected the access token", getProviderName(), e);
        }
        if (e.getStatusCode().is5xxServerError() || status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new ProviderUnavailableException(
                    getProviderName() + " " + operation + " failed with status " + status, getProviderName(), e);
        }
        return new ProviderRejectedException(
                getProviderName() + " " + operation + " rejected with status " + status,
                getProviderName(), String.valueOf(status));
    }

    protected ProviderUnavailableException circuitOpen(String operation, CallNotPermittedException e) {
        log.warn("Circuit breaker open for provider={}, operation={}", getProviderName(), operation);
        return new ProviderUnavailableException(
                getProviderName() + " circuit breaker is open. Service temporarily unavailable.",
                getProviderName(), e);
    }

    protected JsonNode readCallback(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new MalformedCallbackException("Empty callback body", getProviderName());
        }
        try {
            return objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new MalformedCallbackException("Callback body is not valid JSON", getProviderName(), e);
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Converts a provider amount in major units ("500", 500.5) to minor units.
     */
    protected long toMinorUnits(JsonNode amount) {
        if (amount == null || amount.isNull()) {
            throw new MalformedCallbackException("Amount missing", getProviderName());
        }
        try {
            return new BigDecimal(amount.asText()).movePointRight(2).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedCallbackException("Invalid amount: " + amount.asText(), getProviderName(), e);
        }
    }

    protected static BigDecimal toMajorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, 2);
    }

    protected static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Value
    protected static class TokenGrant {
        String token;
        Duration validFor;
    }

    @Value
    private static class CachedToken {
        String token;
        Instant expiresAt;
    }
}
