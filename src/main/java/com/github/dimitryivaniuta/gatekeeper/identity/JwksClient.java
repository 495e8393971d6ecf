package com.github.dimitryivaniuta.gatekeeper.identity;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * Fetches the raw JWKS document, retrying transient failures with exponential backoff.
 */
public class JwksClient {

    private final RestClient restClient;
    private final String jwksUrl;
    private final Retry retry;

    public JwksClient(RestClient restClient, String jwksUrl) {
        this(restClient, jwksUrl, 3, Duration.ofMillis(200));
    }

    public JwksClient(RestClient restClient, String jwksUrl, int maxAttempts, Duration initialBackoff) {
        this.restClient = restClient;
        this.jwksUrl = jwksUrl;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(initialBackoff, 2.0, 0.2))
                .retryExceptions(RestClientException.class)
                .failAfterMaxAttempts(true)
                .build();
        this.retry = Retry.of("jwks", config);
    }

    /**
     * A client whose connect and read both give up after {@code timeout}, so a silent JWKS endpoint
     * fails the fetch instead of holding the calling thread.
     */
    public static RestClient boundedRestClient(RestClient.Builder builder, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return builder.requestFactory(requestFactory).build();
    }

    public String fetch() {
        return retry.executeSupplier(() -> restClient.get()
                .uri(jwksUrl)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class));
    }

    public String url() {
        return jwksUrl;
    }
}
