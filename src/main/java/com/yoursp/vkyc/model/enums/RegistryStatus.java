package com.yoursp.vkyc.model.enums;

/**
 * Answer from the external document registry.
 */
public enum RegistryStatus {
    MATCHED,
    MISMATCHED,
    UNAVAILABLE
}
