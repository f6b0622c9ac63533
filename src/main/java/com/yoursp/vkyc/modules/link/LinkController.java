package com.yoursp.vkyc.modules.link;

import com.yoursp.vkyc.model.entity.VerificationLink;
import com.yoursp.vkyc.modules.link.dto.IssueLinkRequest;
import com.yoursp.vkyc.modules.link.dto.IssuedLinkResponse;
import com.yoursp.vkyc.modules.link.dto.LinkOptionsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Link endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/vkyc/links — issue a link for a customer (consumed by the
 * notification collaborator)</li>
 * <li>GET /api/vkyc/links/{token} — resolve a link to its mode options</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/vkyc/links")
@RequiredArgsConstructor
public class LinkController {

    private final LinkIssuer linkIssuer;

    @PostMapping
    public ResponseEntity<IssuedLinkResponse> issue(@Valid @RequestBody IssueLinkRequest request) {
        VerificationLink link = linkIssuer.issue(request.getCustomerRef());
        return ResponseEntity.status(HttpStatus.CREATED).body(linkIssuer.toResponse(link));
    }

    @GetMapping("/{token}")
    public LinkOptionsResponse resolve(@PathVariable String token) {
        return linkIssuer.resolve(token);
    }
}
