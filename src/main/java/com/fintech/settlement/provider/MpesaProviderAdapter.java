package com.fintech.settlement.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.settlement.config.SettlementProperties;
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

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Safaricom Daraja integration: Lipa Na M-Pesa Online (STK push), STK push query and
 * transaction reversal.
 * <p>
 * Amounts go over the wire as whole shillings. The STK password is
 * base64(shortcode + passkey + timestamp) with the timestamp in Nairobi local time.
 */
@Component
@ConditionalOnProperty(prefix = "settlement.providers.mpesa", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MpesaProviderAdapter extends AbstractHttpProviderAdapter {

    public static final String PROVIDER_NAME = "mpesa";

    static final String DEFAULT_BASE_URL = "https://sandbox.safaricom.co.ke";
    static final String OAUTH_PATH = "/oauth/v1/generate?grant_type=client_credentials";
    static final String STK_PUSH_PATH = "/mpesa/stkpush/v1/processrequest";
    static final String STK_QUERY_PATH = "/mpesa/stkpushquery/v1/query";
    static final String REVERSAL_PATH = "/mpesa/reversal/v1/request";

    /**
     * Daraja answers a status query with this error code while the customer has not responded yet.
     */
    static final String STILL_PROCESSING_CODE = "500.001.1001";
    static final String INVALID_CHECKOUT_ID_CODE = "400.002.02";

    private static final String DEFAULT_TRANSACTION_TYPE = "CustomerPayBillOnline";
    private static final Duration TOKEN_TTL = Duration.ofMinutes(55);
    private static final ZoneId NAIROBI = ZoneId.of("Africa/Nairobi");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final SettlementProperties properties;

    public MpesaProviderAdapter(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                ProviderCredentialsSource credentialsSource,
                                Clock clock,
                                SettlementProperties properties) {
        super(restTemplate, objectMapper, credentialsSource, clock);
        this.properties = properties;
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public CollectionMode collectionMode() {
        return CollectionMode.PUSH_APPROVAL;
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
        String timestamp = timestamp();
        String msisdn = normalizeMsisdn(request.getPayerAccount());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("BusinessShortCode", credentials.getShortcode());
        body.put("Password", password(credentials, timestamp));
        body.put("Timestamp", timestamp);
        body.put("TransactionType", credentials.getTransactionType() != null
                ? credentials.getTransactionType() : DEFAULT_TRANSACTION_TYPE);
        body.put("Amount", wholeShillings(request.getAmount()));
        body.put("PartyA", msisdn);
        body.put("PartyB", credentials.getShortcode());
        body.put("PhoneNumber", msisdn);
        body.put("CallBackURL", request.getCallbackUrl());
        body.put("AccountReference", truncate(request.getAccountReference(), 12));
        body.put("TransactionDesc", truncate(request.getDescription(), 13));

        log.info("Initiating M-Pesa STK push: tenant={}, intentId={}, amount={}",
                request.getTenantId(), request.getIntentId(), request.getAmount());

        JsonNode response = exchange(request.getTenantId(), "initiate", HttpMethod.POST,
                url(credentials, STK_PUSH_PATH), bearerHeaders(request.getTenantId(), credentials), body);

        String responseCode = text(response, "ResponseCode");
        if (!"0".equals(responseCode)) {
            String code = responseCode != null ? responseCode : text(response, "errorCode");
            String description = text(response, "ResponseDescription") != null
                    ? text(response, "ResponseDescription") : text(response, "errorMessage");
            throw new ProviderRejectedException("STK push rejected: " + description, PROVIDER_NAME, code);
        }

        String checkoutRequestId = text(response, "CheckoutRequestID");
        if (checkoutRequestId == null) {
            throw new ProviderUnavailableException("STK push accepted without a CheckoutRequestID", PROVIDER_NAME);
        }

        return ProviderReference.builder()
                .provider(PROVIDER_NAME)
                .reference(checkoutRequestId)
                .secondaryReference(text(response, "MerchantRequestID"))
                .build();
    }

    public ProviderReference initiateFallback(InitiationRequest request, CallNotPermittedException e) {
        throw circuitOpen("initiate", e);
    }

    @Override
    public NormalizedEvent parseCallback(String rawPayload) {
        JsonNode root = readCallback(rawPayload);
        JsonNode callback = root.path("Body").path("stkCallback");
        if (!callback.isObject()) {
            throw new MalformedCallbackException("Missing Body.stkCallback", PROVIDER_NAME);
        }

        String checkoutRequestId = text(callback, "CheckoutRequestID");
        JsonNode resultCode = callback.get("ResultCode");
        if (checkoutRequestId == null || resultCode == null || !resultCode.canConvertToInt()) {
            throw new MalformedCallbackException("Missing CheckoutRequestID or ResultCode", PROVIDER_NAME);
        }

        NormalizedEvent.NormalizedEventBuilder event = NormalizedEvent.builder()
                .provider(PROVIDER_NAME)
                .providerEventId(checkoutRequestId)
                .providerReference(checkoutRequestId);

        if (resultCode.asInt() != 0) {
            return event
                    .outcome(ProviderOutcome.FAILURE)
                    .failureReason(resultCode.asInt() + ": " + text(callback, "ResultDesc"))
                    .build();
        }

        Map<String, JsonNode> metadata = metadataItems(callback);
        return event
                .outcome(ProviderOutcome.SUCCESS)
                .amount(toMinorUnits(metadata.get("Amount")))
                .receiptNumber(metadata.containsKey("MpesaReceiptNumber")
                        ? metadata.get("MpesaReceiptNumber").asText() : null)
                .build();
    }

    private Map<String, JsonNode> metadataItems(JsonNode callback) {
        JsonNode items = callback.path("CallbackMetadata").path("Item");
        if (!items.isArray()) {
            throw new MalformedCallbackException("Successful callback without CallbackMetadata", PROVIDER_NAME);
        }
        Map<String, JsonNode> values = new LinkedHashMap<>();
        for (JsonNode item : items) {
            String name = text(item, "Name");
            if (name != null && item.has("Value")) {
                values.put(name, item.get("Value"));
            }
        }
        return values;
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
        String timestamp = timestamp();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("BusinessShortCode", credentials.getShortcode());
        body.put("Password", password(credentials, timestamp));
        body.put("Timestamp", timestamp);
        body.put("CheckoutRequestID", providerReference);

        JsonNode response = exchangeAllowingErrorBody(tenantId, "queryStatus", HttpMethod.POST,
                url(credentials, STK_QUERY_PATH), bearerHeaders(tenantId, credentials), body);

        String errorCode = text(response, "errorCode");
        if (errorCode != null) {
            if (STILL_PROCESSING_CODE.equals(errorCode)) {
                return ProviderOutcome.PENDING;
            }
            if (INVALID_CHECKOUT_ID_CODE.equals(errorCode)) {
                return ProviderOutcome.NOT_FOUND;
            }
            throw new ProviderUnavailableException(
                    "STK query failed: " + errorCode + " " + text(response, "errorMessage"), PROVIDER_NAME);
        }

        String resultCode = text(response, "ResultCode");
        if (resultCode == null) {
            return ProviderOutcome.PENDING;
        }
        log.debug("M-Pesa query for {} returned ResultCode={} ({})",
                providerReference, resultCode, text(response, "ResultDesc"));
        return "0".equals(resultCode) ? ProviderOutcome.SUCCESS : ProviderOutcome.FAILURE;
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
        String resultUrl = trimTrailingSlash(properties.getCallbackBaseUrl()) + "/" + PROVIDER_NAME;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("Initiator", credentials.getInitiator());
        body.put("SecurityCredential", credentials.getSecurityCredential());
        body.put("CommandID", "TransactionReversal");
        body.put("TransactionID", providerTransactionId);
        body.put("Amount", wholeShillings(amount));
        body.put("ReceiverParty", credentials.getShortcode());
        body.put("ReceiverIdentifierType", "11");
        body.put("ResultURL", resultUrl);
        body.put("QueueTimeOutURL", resultUrl);
        body.put("Remarks", "Transaction reversal");
        body.put("Occasion", "");

        JsonNode response = exchange(tenantId, "reverse", HttpMethod.POST,
                url(credentials, REVERSAL_PATH), bearerHeaders(tenantId, credentials), body);

        String responseCode = text(response, "ResponseCode");
        if (!"0".equals(responseCode)) {
            throw new ProviderRejectedException("Reversal rejected: " + text(response, "ResponseDescription"),
                    PROVIDER_NAME, responseCode);
        }
        log.info("M-Pesa reversal accepted: tenant={}, transactionId={}, conversationId={}",
                tenantId, providerTransactionId, text(response, "ConversationID"));
        // Daraja reports the reversal result asynchronously.
        return ProviderOutcome.PENDING;
    }

    public ProviderOutcome reverseFallback(String tenantId, String providerTransactionId, long amount,
                                           CallNotPermittedException e) {
        throw circuitOpen("reverse", e);
    }

    @Override
    public Map<String, Object> acknowledgement() {
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("ResultCode", 0);
        ack.put("ResultDesc", "Accepted");
        return ack;
    }

    @Override
    protected TokenGrant requestToken(String tenantId, ProviderCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(credentials.getClientId(), credentials.getClientSecret(), StandardCharsets.UTF_8);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        JsonNode response = exchange(tenantId, "authenticate", HttpMethod.GET,
                url(credentials, OAUTH_PATH), headers, null);
        String token = text(response, "access_token");
        if (token == null) {
            throw new ProviderUnavailableException("M-Pesa OAuth response without access_token", PROVIDER_NAME);
        }
        return new TokenGrant(token, TOKEN_TTL);
    }

    String timestamp() {
        return ZonedDateTime.now(clock).withZoneSameInstant(NAIROBI).format(TIMESTAMP_FORMAT);
    }

    static String password(ProviderCredentials credentials, String timestamp) {
        String raw = credentials.getShortcode() + credentials.getPasskey() + timestamp;
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 07XXXXXXXX, +2547XXXXXXXX and 2547XXXXXXXX all become 2547XXXXXXXX.
     */
    static String normalizeMsisdn(String msisdn) {
        if (msisdn == null) {
            throw new ProviderRejectedException("Payer MSISDN is required", PROVIDER_NAME, "INVALID_MSISDN");
        }
        String digits = msisdn.trim().replace("+", "");
        if (digits.startsWith("0")) {
            digits = "254" + digits.substring(1);
        }
        if (!digits.matches("254\\d{9}")) {
            throw new ProviderRejectedException("Invalid MSISDN: " + msisdn, PROVIDER_NAME, "INVALID_MSISDN");
        }
        return digits;
    }

    private static long wholeShillings(long minorUnits) {
        BigDecimal major = toMajorUnits(minorUnits);
        if (major.stripTrailingZeros().scale() > 0) {
            throw new ProviderRejectedException("M-Pesa only accepts whole shilling amounts: " + major,
                    PROVIDER_NAME, "FRACTIONAL_AMOUNT");
        }
        return major.longValueExact();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private static String url(ProviderCredentials credentials, String path) {
        String base = credentials.getBaseUrl() != null ? credentials.getBaseUrl() : DEFAULT_BASE_URL;
        return trimTrailingSlash(base) + path;
    }
}
