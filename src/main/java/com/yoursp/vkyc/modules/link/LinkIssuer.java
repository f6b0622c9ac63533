package com.yoursp.vkyc.modules.link;

import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.entity.VerificationLink;
import com.yoursp.vkyc.model.enums.SessionMode;
import com.yoursp.vkyc.modules.link.dto.IssuedLinkResponse;
import com.yoursp.vkyc.modules.link.dto.LinkOptionsResponse;
import com.yoursp.vkyc.modules.link.exception.LinkException;
import com.yoursp.vkyc.repository.VerificationLinkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Issues and resolves single-use verification links.
 * <ul>
 * <li>Tokens are 32 random bytes, URL-safe base64</li>
 * <li>A link is resolvable until its expiry, and never again once its session
 * has started</li>
 * <li>Re-issuing for a scheduled occurrence supersedes the old link</li>
 * </ul>
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkIssuer {

    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final VerificationLinkRepository linkRepository;
    private final VkycProperties properties;
    private final Clock clock;

    /**
     * Issue a fresh link for a customer with the configured TTL.
     */
    public VerificationLink issue(String customerRef) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return issue(customerRef, now.plus(properties.getLink().getTtl()), null);
    }

    /**
     * Issue a link with an explicit expiry, optionally already bound to a session.
     */
    public VerificationLink issue(String customerRef, OffsetDateTime expiresAt, UUID sessionId) {
        VerificationLink link = VerificationLink.builder()
                .token(generateToken())
                .customerRef(customerRef)
                .sessionId(sessionId)
                .scheduledOccurrence(sessionId != null)
                .issuedAt(OffsetDateTime.now(clock))
                .expiresAt(expiresAt)
                .build();
        VerificationLink saved = linkRepository.save(link);
        log.info("Link issued: linkId={}, customerRef={}, expiresAt={}", saved.getId(), customerRef, expiresAt);
        return saved;
    }

    /**
     * Look up a link that may still start a session.
     *
     * @throws LinkException NOT_FOUND, EXPIRED, or CONSUMED (also for superseded
     *                       links)
     */
    public VerificationLink requireUsable(String token) {
        if (token == null || token.isBlank()) {
            throw LinkException.notFound();
        }
        VerificationLink link = linkRepository.findByToken(token)
                .orElseThrow(LinkException::notFound);

        if (link.isConsumed() || link.isSuperseded()) {
            log.warn("Link reuse rejected: linkId={}, consumed={}, superseded={}",
                    link.getId(), link.isConsumed(), link.isSuperseded());
            throw LinkException.consumed();
        }
        if (link.isExpiredAt(OffsetDateTime.now(clock))) {
            log.info("Link expired: linkId={}, expiresAt={}", link.getId(), link.getExpiresAt());
            throw LinkException.expired();
        }
        return link;
    }

    /**
     * Link resolution boundary: mode options for a usable link.
     */
    public LinkOptionsResponse resolve(String token) {
        VerificationLink link = requireUsable(token);
        // A scheduled-occurrence link already carries its mode
        List<SessionMode> options = link.isScheduledOccurrence()
                ? List.of(SessionMode.IMMEDIATE)
                : List.of(SessionMode.IMMEDIATE, SessionMode.SCHEDULED);
        return LinkOptionsResponse.builder()
                .customerRef(link.getCustomerRef())
                .options(options)
                .expiresAt(link.getExpiresAt())
                .sessionId(link.getSessionId())
                .build();
    }

    public VerificationLink bindToSession(VerificationLink link, UUID sessionId) {
        link.setSessionId(sessionId);
        return linkRepository.save(link);
    }

    /**
     * Mark a link consumed. Consuming twice is a no-op.
     */
    public void consume(UUID linkId) {
        linkRepository.findById(linkId).ifPresent(link -> {
            if (link.isConsumed()) {
                return;
            }
            link.setConsumed(true);
            link.setConsumedAt(OffsetDateTime.now(clock));
            linkRepository.save(link);
            log.debug("Link consumed: linkId={}", linkId);
        });
    }

    /**
     * Retire a link in favour of a newer one. The row is kept for audit.
     */
    public void supersede(UUID linkId) {
        linkRepository.findById(linkId).ifPresent(link -> {
            if (link.isSuperseded()) {
                return;
            }
            link.setSupersededAt(OffsetDateTime.now(clock));
            linkRepository.save(link);
            log.debug("Link superseded: linkId={}", linkId);
        });
    }

    /**
     * Whether a token identifies the user of a session. Consumed links still
     * authenticate the user of their own session; superseded links do not.
     */
    public boolean isSessionCredential(String token, UUID sessionId) {
        if (token == null || token.isBlank() || sessionId == null) {
            return false;
        }
        return linkRepository.findByToken(token)
                .filter(link -> sessionId.equals(link.getSessionId()))
                .filter(link -> !link.isSuperseded())
                .isPresent();
    }

    public OffsetDateTime expiryOf(UUID linkId) {
        return linkRepository.findById(linkId)
                .map(VerificationLink::getExpiresAt)
                .orElseThrow(LinkException::notFound);
    }

    public IssuedLinkResponse toResponse(VerificationLink link) {
        String url = UriComponentsBuilder
                .fromUriString(properties.getFrontendBaseUrl())
                .pathSegment("vkyc", link.getToken())
                .build()
                .toUriString();
        return new IssuedLinkResponse(link.getCustomerRef(), link.getToken(), url, link.getExpiresAt());
    }

    private String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
