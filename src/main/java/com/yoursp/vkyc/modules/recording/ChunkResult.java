package com.yoursp.vkyc.modules.recording;

public enum ChunkResult {
    /** Buffered. */
    ACCEPTED,
    /** Buffered, and the cap is now reached. */
    ACCEPTED_CAP_REACHED,
    /** Would exceed the cap; recording finalized without it. */
    REJECTED_CAP_REACHED,
    /** No recording is buffering for the session. */
    REJECTED_NOT_BUFFERING
}
