package com.yoursp.vkyc.modules.link.dto;

import java.time.OffsetDateTime;

/**
 * What the directory/notification collaborator receives to send by SMS or email.
 */
public record IssuedLinkResponse(String customerRef, String token, String url, OffsetDateTime expiresAt) {
}
