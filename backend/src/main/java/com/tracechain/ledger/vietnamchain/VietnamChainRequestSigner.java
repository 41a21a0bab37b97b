package com.tracechain.ledger.vietnamchain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tracechain.ledger.LedgerConfigurationException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HMAC-SHA256 request authentication for the VietnamChain API. The signed message is
 * {@code METHOD:ENDPOINT:body:timestampMs}, or {@code METHOD:ENDPOINT:timestampMs} without a body; the body is
 * JSON with keys sorted and is sent exactly as signed.
 */
public class VietnamChainRequestSigner {

    public static final String HEADER_API_KEY = "X-Auth-ApiKey";
    public static final String HEADER_TIMESTAMP = "X-Auth-Timestamp";
    public static final String HEADER_SIGNATURE = "X-Auth-Signature";
    public static final String HEADER_ORGANIZATION = "X-Organization-ID";

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final String apiKey;
    private final byte[] apiSecret;
    private final String organizationId;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;

    public VietnamChainRequestSigner(String apiKey, String apiSecret, String organizationId, ObjectMapper objectMapper,
                                     Clock clock) {
        if (isBlank(apiKey) || isBlank(apiSecret) || isBlank(organizationId)) {
            throw new LedgerConfigurationException("VietnamChain api key, api secret and organization id are required");
        }
        this.apiKey = apiKey;
        this.apiSecret = apiSecret.getBytes(StandardCharsets.UTF_8);
        this.organizationId = organizationId;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    /** Compact JSON with map keys in natural order. */
    public String canonicalJson(Map<String, Object> body) {
        try {
            return canonicalMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serialisable", e);
        }
    }

    /**
     * Authentication headers for one request.
     *
     * @param canonicalBody body as produced by {@link #canonicalJson(Map)}, or null for requests without a body
     */
    public Map<String, String> sign(String method, String endpoint, String canonicalBody) {
        String timestamp = Long.toString(clock.millis());
        String message = canonicalBody == null
                ? method.toUpperCase(Locale.ROOT) + ":" + endpoint + ":" + timestamp
                : method.toUpperCase(Locale.ROOT) + ":" + endpoint + ":" + canonicalBody + ":" + timestamp;
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_API_KEY, apiKey);
        headers.put(HEADER_TIMESTAMP, timestamp);
        headers.put(HEADER_SIGNATURE, Base64.getEncoder().encodeToString(hmac(message)));
        headers.put(HEADER_ORGANIZATION, organizationId);
        return headers;
    }

    private byte[] hmac(String message) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(apiSecret, HMAC_SHA256));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    public String getApiKey() {
        return apiKey;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
