package com.github.dimitryivaniuta.gatekeeper.web;

import com.github.dimitryivaniuta.gatekeeper.config.GatekeeperProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller address used for IP-level limits. Forwarding headers are only honoured when
 * explicitly trusted; otherwise any client could pick its own bucket.
 */
@Component
public class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private final boolean trustForwardedHeaders;

    @Autowired
    public ClientIpResolver(GatekeeperProperties properties) {
        this(properties.isTrustForwardedHeaders());
    }

    public ClientIpResolver(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public String resolve(HttpServletRequest req) {
        if (trustForwardedHeaders) {
            // X-Forwarded-For may contain "client, proxy1, proxy2"
            String xff = header(req, RequestContextKeys.FORWARDED_FOR_HEADER);
            if (xff != null) {
                int comma = xff.indexOf(',');
                String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
                if (!first.isBlank()) return first;
            }
            String realIp = header(req, RequestContextKeys.REAL_IP_HEADER);
            if (realIp != null) return realIp;
        }

        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? UNKNOWN : ra.trim();
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
