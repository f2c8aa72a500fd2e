package com.secretnotes;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the rate-limit identity of a request.
 *
 * Order: trusted proxy header, then the peer address, then a shared
 * "unknown" bucket. Every unattributable client shares that one budget.
 */
public class ClientIdentityResolver {

    public static final String UNKNOWN = "unknown";

    private final String trustedHeader;

    public ClientIdentityResolver(String trustedHeader) {
        this.trustedHeader = trustedHeader;
    }

    public String resolve(HttpServletRequest request) {
        if (trustedHeader != null && !trustedHeader.isBlank()) {
            String forwarded = request.getHeader(trustedHeader);
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.trim();
            }
        }
        String peer = request.getRemoteAddr();
        if (peer != null && !peer.isBlank()) {
            return peer;
        }
        return UNKNOWN;
    }
}
