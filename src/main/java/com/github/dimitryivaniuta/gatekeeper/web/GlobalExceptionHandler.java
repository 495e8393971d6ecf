package com.github.dimitryivaniuta.gatekeeper.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.dimitryivaniuta.gatekeeper.gate.GateErrorCode;
import com.github.dimitryivaniuta.gatekeeper.gate.GateFailure;
import com.github.dimitryivaniuta.gatekeeper.gate.GateRejectedException;
import com.github.dimitryivaniuta.gatekeeper.keystore.KeyStoreUnavailableException;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.Granularity;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;


@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Problem(
            String type,
            String title,
            int status,
            String detail,
            String code,
            String instance,
            String correlationId,
            Granularity violatedGranularity,
            Long retryAfterSeconds
    ) {}

    @ExceptionHandler(GateRejectedException.class)
    public ResponseEntity<Problem> handleRejected(GateRejectedException ex, HttpServletRequest req) {
        GateFailure f = ex.getFailure();
        HttpHeaders h = new HttpHeaders();
        Long retryAfter = null;
        if (f.rateLimitHeaders() != null) {
            f.rateLimitHeaders().asMap().forEach(h::set);
            retryAfter = f.rateLimitHeaders().retryAfterSeconds();
        }
        return problem(f.code(), f.detail(), req, h, f.violatedGranularity(), retryAfter);
    }

    @ExceptionHandler(KeyStoreUnavailableException.class)
    public ResponseEntity<Problem> handleKeyStore(KeyStoreUnavailableException ex, HttpServletRequest req) {
        log.warn("Key store unavailable: {}", ex.getMessage());
        return problem(GateErrorCode.SERVICE_UNAVAILABLE, "Credential store is temporarily unavailable", req,
                new HttpHeaders(), null, null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Problem> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return plain(status, ex.getReason(), req);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
    public ResponseEntity<Problem> handleValidation(Exception ex, HttpServletRequest req) {
        return plain(HttpStatus.BAD_REQUEST, "Validation failed", req);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Problem> noResource(NoResourceFoundException ex, HttpServletRequest req) {
        return plain(HttpStatus.NOT_FOUND, ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Problem> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return problem(GateErrorCode.INTERNAL_ERROR, "Unexpected error", req, new HttpHeaders(), null, null);
    }

    private ResponseEntity<Problem> problem(GateErrorCode code, String detail, HttpServletRequest req,
                                            HttpHeaders headers, Granularity granularity, Long retryAfter) {
        HttpStatus status = code.status();
        Problem body = new Problem(
                code.type(),
                code.title(),
                status.value(),
                (detail == null || detail.isBlank()) ? code.title() : detail,
                code.name(),
                req.getRequestURI(),
                CorrelationIdFilter.current(req),
                granularity,
                retryAfter
        );
        return ResponseEntity.status(status)
                .headers(headers)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(body);
    }

    private ResponseEntity<Problem> plain(HttpStatus status, String detail, HttpServletRequest req) {
        Problem body = new Problem(
                "about:blank",
                status.getReasonPhrase(),
                status.value(),
                (detail == null || detail.isBlank()) ? status.getReasonPhrase() : detail,
                null,
                req.getRequestURI(),
                CorrelationIdFilter.current(req),
                null,
                null
        );
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_PROBLEM_JSON).body(body);
    }
}
