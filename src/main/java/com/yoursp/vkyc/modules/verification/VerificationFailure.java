package com.yoursp.vkyc.modules.verification;

/**
 * Why a document could not be verified.
 */
public enum VerificationFailure {
    LOW_CONFIDENCE,
    OCR_UNAVAILABLE,
    REGISTRY_MISMATCH
}
