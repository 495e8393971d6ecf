package com.github.dimitryivaniuta.gatekeeper.web;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class ClientIpResolverTest {

    private static MockHttpServletRequest request() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.5");
        req.addHeader(RequestContextKeys.FORWARDED_FOR_HEADER, "203.0.113.7, 10.0.0.1");
        req.addHeader(RequestContextKeys.REAL_IP_HEADER, "198.51.100.9");
        return req;
    }

    @Test
    void shouldIgnoreForwardingHeadersUnlessTrusted() {
        assertThat(new ClientIpResolver(false).resolve(request())).isEqualTo("10.0.0.5");
    }

    @Test
    void shouldUseFirstForwardedAddressWhenTrusted() {
        assertThat(new ClientIpResolver(true).resolve(request())).isEqualTo("203.0.113.7");
    }

    @Test
    void shouldFallBackToRealIpThenRemoteAddress() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.5");
        req.addHeader(RequestContextKeys.REAL_IP_HEADER, "198.51.100.9");
        assertThat(new ClientIpResolver(true).resolve(req)).isEqualTo("198.51.100.9");

        MockHttpServletRequest bare = new MockHttpServletRequest();
        bare.setRemoteAddr("");
        assertThat(new ClientIpResolver(true).resolve(bare)).isEqualTo(ClientIpResolver.UNKNOWN);
    }
}
