/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Binds the request id and the calling identity to the logging context for one HTTP request.
 * <p>
 * The request id ends up in usage rows and error bodies, so a client-supplied value is only
 * kept when it is a short token; anything else is replaced by a fresh UUID. The caller id is
 * logged as sent and resolved to a trust score later by the router.
 */
@Component("conductoRequestContextFilter")
public class RequestContextFilter extends OncePerRequestFilter {
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CALLER_HEADER = "X-Caller-Id";
    public static final String REQUEST_ID_KEY = "requestId";
    public static final String CALLER_ID_KEY = "callerId";

    private static final Pattern SAFE_TOKEN = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = acceptedOrNull(request.getHeader(REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        String callerId = acceptedOrNull(request.getHeader(CALLER_HEADER));

        MDC.put(REQUEST_ID_KEY, requestId);
        if (callerId != null) {
            MDC.put(CALLER_ID_KEY, callerId);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(CALLER_ID_KEY);
        }
    }

    static String acceptedOrNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return SAFE_TOKEN.matcher(trimmed).matches() ? trimmed : null;
    }
}
