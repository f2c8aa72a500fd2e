package com.secretnotes;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class ClientIdentityResolverTest {

    private final ClientIdentityResolver resolver = new ClientIdentityResolver("CF-Connecting-IP");

    @Test
    @DisplayName("Should prefer the trusted proxy header")
    void shouldPreferTrustedHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.1");
        request.addHeader("CF-Connecting-IP", " 203.0.113.7 ");

        assertEquals("203.0.113.7", resolver.resolve(request));
    }

    @Test
    @DisplayName("Should fall back to the peer address")
    void shouldFallBackToPeerAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.1");
        request.addHeader("X-Forwarded-For", "198.51.100.1");

        assertEquals("10.0.0.1", resolver.resolve(request));
    }

    @Test
    @DisplayName("Should put unattributable clients in the shared unknown bucket")
    void shouldUseUnknownBucket() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(null);

        assertEquals(ClientIdentityResolver.UNKNOWN, resolver.resolve(request));
    }

    @Test
    @DisplayName("Should ignore headers when no trusted header is configured")
    void shouldIgnoreHeadersWithoutTrustedHeader() {
        ClientIdentityResolver direct = new ClientIdentityResolver("");
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.1");
        request.addHeader("CF-Connecting-IP", "203.0.113.7");

        assertEquals("10.0.0.1", direct.resolve(request));
    }
}
