package com.tracechain.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Unwraps JSON-RPC 2.0 response envelopes shared by the EVM and Substrate clients.
 */
public final class JsonRpcSupport {

    private JsonRpcSupport() {
    }

    /**
     * Returns the {@code result} node (possibly JSON null).
     *
     * @throws LedgerConnectivityException when the body is missing or not JSON
     * @throws LedgerRejectionException    when the envelope carries an {@code error} object
     */
    public static JsonNode result(ObjectMapper objectMapper, String method, String body) {
        if (body == null || body.isBlank()) {
            throw new LedgerConnectivityException(method + " returned empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LedgerConnectivityException(method + " returned invalid JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new LedgerRejectionException(method + " error: " + error.path("message").asText(error.toString()));
        }
        return root.path("result");
    }

    /** Parses a 0x-prefixed hex quantity. */
    public static long hexToLong(String method, JsonNode node) {
        String text = node == null || node.isNull() ? null : node.asText(null);
        if (text == null || !text.startsWith("0x")) {
            throw new LedgerRejectionException(method + " invalid quantity: " + text);
        }
        return Long.parseLong(text.substring(2), 16);
    }

    /**
     * Maps WebClient failures onto the ledger exception hierarchy: 429 and 5xx are connectivity problems, other
     * HTTP errors are rejections. Anything else passes through unchanged.
     */
    public static Throwable mapTransportError(String operation, Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            int code = wcre.getStatusCode().value();
            if (code == 429 || code >= 500) {
                return new LedgerConnectivityException(operation + " HTTP " + code, e);
            }
            return new LedgerRejectionException(operation + " HTTP " + code + ": " + wcre.getResponseBodyAsString(), e);
        }
        if (e instanceof WebClientRequestException || e instanceof TimeoutException) {
            return new LedgerConnectivityException(operation + " unreachable: " + e.getMessage(), e);
        }
        return e;
    }
}
