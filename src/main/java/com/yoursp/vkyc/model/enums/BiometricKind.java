package com.yoursp.vkyc.model.enums;

import java.util.Locale;

public enum BiometricKind {

    BLINK,
    HEAD_POSE,
    IP_SAMPLE,
    GEO_SAMPLE;

    public static BiometricKind fromClientValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Biometric event kind is missing");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "BLINK" -> BLINK;
            case "HEAD_POSE", "HEAD_MOVEMENT" -> HEAD_POSE;
            case "IP", "IP_ADDRESS", "IP_SAMPLE" -> IP_SAMPLE;
            case "GEO", "LOCATION", "GEO_SAMPLE" -> GEO_SAMPLE;
            default -> throw new IllegalArgumentException("Unsupported biometric event kind: " + value);
        };
    }
}
