package com.yoursp.vkyc.modules.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.yoursp.vkyc.config.ExternalServiceProperties;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.modules.verification.exception.OcrUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OCR over HTTP: {@code POST {base-url}/{pan|aadhaar}} with a base64 image.
 * <p>
 * Expected response: {@code {"success": true, "confidence": 0.93, "fields": {...}}}.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpOcrClient implements OcrClient {

    @Qualifier("ocrRestTemplate")
    private final RestTemplate ocrRestTemplate;
    private final ExternalServiceProperties properties;

    @Override
    public OcrResult extract(byte[] image, DocumentType documentType) {
        String endpoint = properties.getOcr().endpointFor(documentType.getRegistryCode());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, String> body = Map.of("image", Base64.getEncoder().encodeToString(image));

        JsonNode response;
        try {
            response = ocrRestTemplate.postForObject(endpoint, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new OcrUnavailableException("OCR call failed: " + e.getMessage(), e);
        }

        if (response == null || !response.path("success").asBoolean(false)) {
            String error = response != null ? response.path("error").asText("unknown") : "empty response";
            throw new OcrUnavailableException("OCR rejected image: " + error);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        response.path("fields").fields()
                .forEachRemaining(entry -> fields.put(entry.getKey(), entry.getValue().asText()));
        double confidence = response.path("confidence").asDouble(0.0);

        // Log field names only — never document numbers
        log.info("OCR response: doc={}, confidence={}, fields={}", documentType, confidence, fields.keySet());
        return new OcrResult(fields, confidence);
    }
}
