package com.yoursp.vkyc.mock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Mock OCR endpoints for local development.
 * <p>
 * Active only when the "mock" Spring profile is enabled. Any image is "read"
 * with high confidence unless its bytes contain {@code LOW_CONFIDENCE}.
 * </p>
 *
 * <pre>
 * Run with: SPRING_PROFILES_ACTIVE=mock mvn spring-boot:run
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/mock/ocr")
@Profile("mock")
public class MockOcrController {

    @PostMapping("/pan")
    public Map<String, Object> pan(@RequestBody Map<String, String> request) {
        double confidence = confidenceFor(request);
        log.info("[MOCK] PAN OCR request, confidence={}", confidence);
        return Map.of(
                "success", true,
                "confidence", confidence,
                "fields", Map.of(
                        "pan_number", "ABCDE1234F",
                        "name", "TEST CUSTOMER",
                        "dob", "1990-01-01"));
    }

    @PostMapping("/aadhaar")
    public Map<String, Object> aadhaar(@RequestBody Map<String, String> request) {
        double confidence = confidenceFor(request);
        log.info("[MOCK] Aadhaar OCR request, confidence={}", confidence);
        return Map.of(
                "success", true,
                "confidence", confidence,
                "fields", Map.of(
                        "aadhaar_number", "123456789012",
                        "name", "TEST CUSTOMER",
                        "gender", "F"));
    }

    private double confidenceFor(Map<String, String> request) {
        String image = request.getOrDefault("image", "");
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(image), StandardCharsets.ISO_8859_1);
        } catch (IllegalArgumentException e) {
            return 0.0;
        }
        return decoded.contains("LOW_CONFIDENCE") ? 0.35 : 0.92;
    }
}
