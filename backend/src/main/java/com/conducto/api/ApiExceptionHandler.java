/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api;

import com.conducto.application.routing.AllProvidersExhaustedException;
import com.conducto.application.routing.RoutingException;
import com.conducto.config.RequestContextFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RoutingException.class)
    public ResponseEntity<ApiErrorResponse> handleRouting(RoutingException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case TRUST_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case NO_ELIGIBLE_PROVIDER -> HttpStatus.FORBIDDEN;
            case ALL_PROVIDERS_EXHAUSTED -> HttpStatus.BAD_GATEWAY;
            case DEADLINE_EXCEEDED -> HttpStatus.GATEWAY_TIMEOUT;
        };
        return respond(status, ex.getCode().name(), publicMessage(ex));
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getStatus().name(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        String requestId = currentRequestId();
        log.error("Unhandled exception requestId={}", requestId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    // ---------- helpers ----------

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                currentRequestId()
        );
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Never leaks provider internals: only the kind of the last failure is exposed.
     */
    private static String publicMessage(RoutingException ex) {
        if (ex instanceof AllProvidersExhaustedException exhausted) {
            String base = switch (ex.getCode()) {
                case DEADLINE_EXCEEDED -> "Deadline exceeded before any provider answered";
                default -> "All providers failed";
            };
            if (exhausted.getLastError() == null) return base;
            return base + " (attempts=" + exhausted.getAttempts() + ", last=" + exhausted.getLastError().getType() + ")";
        }
        return switch (ex.getCode()) {
            case TRUST_UNAVAILABLE -> "Trust service unavailable";
            case NO_ELIGIBLE_PROVIDER -> "No provider available for your trust level";
            default -> "Routing failed";
        };
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestContextFilter.REQUEST_ID_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
