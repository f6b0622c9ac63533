package com.yoursp.vkyc.model.enums;

public enum RecordingState {
    BUFFERING,
    FINALIZING,
    DONE,
    FAILED
}
