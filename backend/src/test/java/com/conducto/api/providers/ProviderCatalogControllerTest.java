/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api.providers;

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
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ProviderCatalogControllerTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void listsSeededProvidersWithModels() throws Exception {
        ResponseEntity<String> res = restTemplate.getForEntity("/api/providers", String.class);

        assertEquals(HttpStatus.OK, res.getStatusCode());
        List<Map<String, Object>> providers = objectMapper.readValue(res.getBody(), new TypeReference<>() {});
        Map<String, Object> mock = providers.get(0);
        assertEquals("mock", mock.get("id"));
        assertEquals("MOCK", mock.get("kind"));
        assertEquals(true, mock.get("adapterAvailable"));
        List<?> models = (List<?>) mock.get("models");
        assertEquals("mock-premium", ((Map<?, ?>) models.get(0)).get("modelName"));
        assertTrue(providers.stream().anyMatch(p -> "openai".equals(p.get("id")) && Boolean.FALSE.equals(p.get("active"))));
    }

    @Test
    void callerTierIsDerivedFromTrust() throws Exception {
        Map<String, Object> premium = objectMapper.readValue(
                restTemplate.getForObject("/api/callers/demo-premium/tier", String.class), new TypeReference<>() {});
        Map<String, Object> unknown = objectMapper.readValue(
                restTemplate.getForObject("/api/callers/somebody-new/tier", String.class), new TypeReference<>() {});

        assertEquals("premium", premium.get("tier"));
        assertEquals(85, premium.get("trustScore"));
        assertEquals("standard", unknown.get("tier"));
        assertEquals(50, unknown.get("trustScore"));
    }

    @Test
    void usageAnalyticsReflectsRoutedTraffic() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(RequestContextFilter.CALLER_HEADER, "demo-standard");
        ResponseEntity<String> chat = restTemplate.exchange("/api/ai/chat", HttpMethod.POST,
                new HttpEntity<>("{\"messages\":[{\"role\":\"user\",\"content\":\"ping\"}]}", headers), String.class);
        assertEquals(HttpStatus.OK, chat.getStatusCode());

        List<Map<String, Object>> usage = objectMapper.readValue(
                restTemplate.getForObject("/api/analytics/usage?days=7", String.class), new TypeReference<>() {});

        Map<String, Object> mock = usage.stream().filter(u -> "mock".equals(u.get("providerId"))).findFirst().orElseThrow();
        assertTrue(((Number) mock.get("requests")).longValue() >= 1);
        assertEquals(100.0, ((Number) mock.get("successRate")).doubleValue(), 1e-9);
    }

    @Test
    void adminHealthListsEveryProvider() throws Exception {
        List<Map<String, Object>> health = objectMapper.readValue(
                restTemplate.getForObject("/api/admin/routing/health", String.class), new TypeReference<>() {});

        assertTrue(health.size() >= 4);
        assertEquals("mock", health.get(0).get("providerId"));
    }
}
