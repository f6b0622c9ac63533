package com.yoursp.vkyc.model.enums;

import java.util.Locale;

/**
 * Identity documents that can be captured during a call.
 */
public enum DocumentType {

    PAN("pan"),
    AADHAAR("aadhaar");

    private final String registryCode;

    DocumentType(String registryCode) {
        this.registryCode = registryCode;
    }

    /** Lower-case code used by the OCR and registry endpoints. */
    public String getRegistryCode() {
        return registryCode;
    }

    /**
     * Lenient parse accepting the client spellings ("pan", "aadhaar_front", "AADHAAR").
     * <p>
     * Both Aadhaar sides are one document: they share a result row, an in-flight
     * slot and the OCR attempt limit, and the latest verified side decides the
     * document's status.
     * </p>
     */
    public static DocumentType fromClientValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Document type is missing");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("pan")) {
            return PAN;
        }
        if (normalized.startsWith("aadhaar")) {
            return AADHAAR;
        }
        throw new IllegalArgumentException("Unsupported document type: " + value);
    }
}
