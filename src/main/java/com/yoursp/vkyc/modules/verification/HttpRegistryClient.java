package com.yoursp.vkyc.modules.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.yoursp.vkyc.config.ExternalServiceProperties;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.RegistryStatus;
import com.yoursp.vkyc.modules.verification.exception.RegistryTransientException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;
import java.util.Map;

/**
 * Document registry (DigiLocker-style) over HTTP.
 * <p>
 * Sends {@code {"doc_type": "pan", "doc_info": {...}}} with a bearer API key.
 * Understands both {@code {"status": "matched|mismatched|unavailable"}} and the
 * legacy {@code {"verified": true|false}} answer. Protected by a Resilience4j
 * circuit breaker.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpRegistryClient implements RegistryClient {

    @Qualifier("registryRestTemplate")
    private final RestTemplate registryRestTemplate;
    private final ExternalServiceProperties properties;

    @Override
    @CircuitBreaker(name = "registryCircuitBreaker", fallbackMethod = "verifyFallback")
    public RegistryStatus verify(Map<String, String> fields, DocumentType documentType) {
        ExternalServiceProperties.Registry config = properties.getRegistry();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.setBearerAuth(config.getApiKey());
        }
        Map<String, Object> body = Map.of(
                "doc_type", documentType.getRegistryCode(),
                "doc_info", fields);

        JsonNode response;
        try {
            response = registryRestTemplate.postForObject(config.getUrl(), new HttpEntity<>(body, headers),
                    JsonNode.class);
        } catch (RestClientException e) {
            throw new RegistryTransientException("Registry call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new RegistryTransientException("Registry returned an empty body");
        }

        RegistryStatus status = parseStatus(response);
        log.info("Registry response: doc={}, status={}", documentType, status);
        return status;
    }

    private RegistryStatus parseStatus(JsonNode response) {
        String status = response.path("status").asText("");
        if (!status.isBlank()) {
            try {
                return RegistryStatus.valueOf(status.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new RegistryTransientException("Unknown registry status: " + status);
            }
        }
        if (response.has("verified")) {
            return response.path("verified").asBoolean() ? RegistryStatus.MATCHED : RegistryStatus.MISMATCHED;
        }
        throw new RegistryTransientException("Registry response carries no status");
    }

    @SuppressWarnings("unused")
    private RegistryStatus verifyFallback(Map<String, String> fields, DocumentType documentType, Throwable t) {
        log.warn("Registry circuit breaker fallback: doc={}, error={}", documentType, t.getMessage());
        if (t instanceof RegistryTransientException transientFailure) {
            throw transientFailure;
        }
        throw new RegistryTransientException("Registry temporarily unavailable: " + t.getMessage(), t);
    }
}
