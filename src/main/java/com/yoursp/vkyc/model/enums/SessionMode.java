package com.yoursp.vkyc.model.enums;

public enum SessionMode {
    IMMEDIATE,
    SCHEDULED
}
