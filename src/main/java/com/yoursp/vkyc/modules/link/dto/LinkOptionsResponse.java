package com.yoursp.vkyc.modules.link.dto;

import com.yoursp.vkyc.model.enums.SessionMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Result of resolving a link: which modes the customer may pick.
 */
@Getter
@Builder
@AllArgsConstructor
public class LinkOptionsResponse {

    private String customerRef;
    private List<SessionMode> options;
    private OffsetDateTime expiresAt;
    /** Present when the link is already bound to a session (scheduled occurrence). */
    private UUID sessionId;
}
