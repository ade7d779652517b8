package com.cleancity.api.integration;

import com.cleancity.api.CleanCityApiApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for per-IP rate limiting.
 */
@SpringBootTest(
    classes = CleanCityApiApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "cleancity.rate-limit.enabled=true",
        "cleancity.rate-limit.scopes.api.max-requests=3",
        "cleancity.rate-limit.scopes.api.window=1m",
        "cleancity.rate-limit.scopes.report.max-requests=2",
        "cleancity.rate-limit.scopes.report.window=1m"
    }
)
@ActiveProfiles("test")
class RateLimitIntegrationTest {

    private static final AtomicInteger CLIENTS = new AtomicInteger();

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port + "/api/v1";
    }

    @Test
    void rateLimitHeader_shouldCountDownRemainingRequests() {
        HttpHeaders headers = clientHeaders(newClientIp());

        ResponseEntity<String> first = get("/reports/" + UUID.randomUUID(), headers);
        ResponseEntity<String> second = get("/reports/" + UUID.randomUUID(), headers);

        assertThat(first.getHeaders().getFirst("X-Rate-Limit-Remaining")).isEqualTo("2");
        assertThat(second.getHeaders().getFirst("X-Rate-Limit-Remaining")).isEqualTo("1");
    }

    @Test
    void exceedingLimit_shouldReturn429WithRetryAfter() {
        HttpHeaders headers = clientHeaders(newClientIp());
        for (int i = 0; i < 3; i++) {
            get("/reports/" + UUID.randomUUID(), headers);
        }

        ResponseEntity<Map> response = restTemplate.exchange(baseUrl + "/reports/" + UUID.randomUUID(),
            HttpMethod.GET, new HttpEntity<>(headers), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody()).containsEntry("code", "RATE_LIMIT_EXCEEDED");
        long retryAfter = Long.parseLong(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        assertThat(retryAfter).isBetween(1L, 60L);
    }

    @Test
    void limits_shouldBeTrackedPerClient() {
        HttpHeaders noisy = clientHeaders(newClientIp());
        for (int i = 0; i < 4; i++) {
            get("/reports/" + UUID.randomUUID(), noisy);
        }

        ResponseEntity<String> other = get("/reports/" + UUID.randomUUID(), clientHeaders(newClientIp()));

        assertThat(other.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void reportSubmissions_shouldUseTheirOwnScope() {
        HttpHeaders headers = clientHeaders(newClientIp());
        headers.set("X-Device-Id", "rl_" + UUID.randomUUID().toString().replace("-", ""));

        for (int i = 0; i < 2; i++) {
            ResponseEntity<String> allowed = restTemplate.exchange(baseUrl + "/reports",
                HttpMethod.POST, new HttpEntity<>("{}", headers), String.class);
            assertThat(allowed.getStatusCode()).isNotEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        }
        ResponseEntity<String> limited = restTemplate.exchange(baseUrl + "/reports",
            HttpMethod.POST, new HttpEntity<>("{}", headers), String.class);

        assertThat(limited.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    }

    @Test
    void healthEndpoint_shouldNeverBeLimited() {
        HttpHeaders headers = clientHeaders(newClientIp());
        for (int i = 0; i < 6; i++) {
            assertThat(get("/health", headers).getStatusCode()).isEqualTo(HttpStatus.OK);
        }
    }

    private ResponseEntity<String> get(String path, HttpHeaders headers) {
        return restTemplate.exchange(baseUrl + path, HttpMethod.GET, new HttpEntity<>(headers), String.class);
    }

    private static HttpHeaders clientHeaders(String ip) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Forwarded-For", ip);
        return headers;
    }

    private static String newClientIp() {
        return "10.20.0." + CLIENTS.incrementAndGet();
    }
}
