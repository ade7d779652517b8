package com.cleancity.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-scope fixed-window rate limits.
 *
 * api: 100 requests per minute per IP.
 * report: 20 submissions per minute per IP.
 */
@Configuration
@ConfigurationProperties(prefix = "cleancity.rate-limit")
public class RateLimitConfig {

    public static final String SCOPE_API = "api";
    public static final String SCOPE_REPORT = "report";

    private boolean enabled = true;
    private Map<String, Limit> scopes = new LinkedHashMap<>(Map.of(
            SCOPE_API, new Limit(100, Duration.ofMinutes(1)),
            SCOPE_REPORT, new Limit(20, Duration.ofMinutes(1))
    ));

    public Limit limitFor(String scope) {
        Limit limit = scopes.get(scope);
        return limit != null ? limit : scopes.get(SCOPE_API);
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Map<String, Limit> getScopes() { return scopes; }
    public void setScopes(Map<String, Limit> scopes) { this.scopes = scopes; }

    public static class Limit {
        private int maxRequests;
        private Duration window;

        public Limit() {}

        public Limit(int maxRequests, Duration window) {
            this.maxRequests = maxRequests;
            this.window = window;
        }

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }
}
