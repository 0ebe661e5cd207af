/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api;

import com.conducto.config.RequestContextFilter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class ApiErrorHandlingTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void noActiveProviderIsForbiddenWithRequestId() throws Exception {
        setActive("mock", false);
        try {
            ResponseEntity<String> res = exchange(HttpMethod.POST, "/api/ai/chat", "no-eligible-1", """
                    {"messages":[{"role":"user","content":"hello"}]}
                    """);

            assertEquals(HttpStatus.FORBIDDEN, res.getStatusCode());
            Map<String, Object> body = read(res);
            assertEquals("NO_ELIGIBLE_PROVIDER", body.get("code"));
            assertEquals("FORBIDDEN", body.get("error"));
            assertEquals("no-eligible-1", body.get("requestId"));
            assertNotNull(body.get("message"));
        } finally {
            setActive("mock", true);
        }
    }

    @Test
    void unknownProviderIsNotFound() throws Exception {
        ResponseEntity<String> res = exchange(HttpMethod.PUT, "/api/admin/providers/nope/active", "admin-404", """
                {"active":true}
                """);

        assertEquals(HttpStatus.NOT_FOUND, res.getStatusCode());
        assertEquals("NOT_FOUND", read(res).get("code"));
    }

    @Test
    void priorityOutOfRangeIsRejected() throws Exception {
        ResponseEntity<String> res = exchange(HttpMethod.PUT, "/api/admin/providers/mock/priority", "admin-400", """
                {"priority":150}
                """);

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("VALIDATION_ERROR", read(res).get("code"));
    }

    @Test
    void malformedJsonIsValidationError() throws Exception {
        ResponseEntity<String> res = exchange(HttpMethod.POST, "/api/ai/chat", "bad-json-1", "{not json");

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("bad-json-1", read(res).get("requestId"));
    }

    @Test
    void analyticsWindowIsValidated() throws Exception {
        ResponseEntity<String> res = restTemplate.getForEntity("/api/analytics/usage?days=0", String.class);

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("BAD_REQUEST", read(res).get("code"));
    }

    private void setActive(String providerId, boolean active) {
        ResponseEntity<String> res = exchange(HttpMethod.PUT, "/api/admin/providers/" + providerId + "/active",
                "admin-toggle", "{\"active\":" + active + "}");
        assertEquals(HttpStatus.OK, res.getStatusCode());
    }

    private ResponseEntity<String> exchange(HttpMethod method, String path, String requestId, String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(RequestContextFilter.REQUEST_ID_HEADER, requestId);
        headers.set(RequestContextFilter.CALLER_HEADER, "demo-premium");
        return restTemplate.exchange(path, method, new HttpEntity<>(json, headers), String.class);
    }

    private Map<String, Object> read(ResponseEntity<String> res) throws Exception {
        return objectMapper.readValue(res.getBody(), new TypeReference<>() {});
    }
}
