package com.yoursp.vkyc.mock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Mock DigiLocker-style registry for local development.
 * <p>
 * Active only when the "mock" Spring profile is enabled. Answers
 * {@code matched} unless a field value contains {@code MISMATCH}
 * ({@code mismatched}) or {@code OUTAGE} (HTTP 503).
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/mock/registry")
@Profile("mock")
public class MockRegistryController {

    @PostMapping("/verify")
    public ResponseEntity<Map<String, Object>> verify(@RequestBody Map<String, Object> request) {
        String docType = String.valueOf(request.get("doc_type"));
        String docInfo = String.valueOf(request.get("doc_info"));
        log.info("[MOCK] Registry verify request: doc_type={}", docType);

        if (docInfo.contains("OUTAGE")) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", "unavailable"));
        }
        String status = docInfo.contains("MISMATCH") ? "mismatched" : "matched";
        return ResponseEntity.ok(Map.of(
                "status", status,
                "message", "Verification completed"));
    }
}
