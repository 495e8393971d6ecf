package com.github.dimitryivaniuta.gatekeeper.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String SITE_ID_HEADER = "X-Site-Id";

    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    public static final String REAL_IP_HEADER = "X-Real-IP";
}
