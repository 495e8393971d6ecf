package com.github.dimitryivaniuta.gatekeeper.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a correlation id: the caller's {@code X-Correlation-Id} when it is a plain
 * token, otherwise a fresh UUID. The id goes to the MDC for log lines, to a request attribute for
 * problem payloads, and back to the caller on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".id";

    // rejects anything that could split a log line or a response header
    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String correlationId = accept(request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER));

        request.setAttribute(REQUEST_ATTRIBUTE, correlationId);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, correlationId);
        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, correlationId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    /** The id assigned to this request, or the MDC value when the filter did not run. */
    public static String current(HttpServletRequest request) {
        Object id = request.getAttribute(REQUEST_ATTRIBUTE);
        return id instanceof String s ? s : MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY);
    }

    static String accept(String presented) {
        if (presented != null) {
            String trimmed = presented.trim();
            if (ACCEPTED.matcher(trimmed).matches()) return trimmed;
        }
        return UUID.randomUUID().toString();
    }
}
