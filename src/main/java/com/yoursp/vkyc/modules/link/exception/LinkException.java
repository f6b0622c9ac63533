package com.yoursp.vkyc.modules.link.exception;

import lombok.Getter;

/**
 * Thrown when a verification link cannot be used. The customer must be sent a
 * new link.
 */
@Getter
public class LinkException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        EXPIRED,
        CONSUMED
    }

    private final Reason reason;

    public LinkException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static LinkException notFound() {
        return new LinkException(Reason.NOT_FOUND, "Verification link not found");
    }

    public static LinkException expired() {
        return new LinkException(Reason.EXPIRED, "Verification link has expired");
    }

    public static LinkException consumed() {
        return new LinkException(Reason.CONSUMED, "Verification link has already been used");
    }
}
