package com.cleancity.api.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitInterceptorTest {

    @Test
    void reportSubmission_usesReportScope() {
        var request = new MockHttpServletRequest("POST", "/api/v1/reports");

        assertThat(RateLimitInterceptor.selectScope(request)).isEqualTo(RateLimitConfig.SCOPE_REPORT);
    }

    @Test
    void reportReads_useApiScope() {
        var request = new MockHttpServletRequest("GET", "/api/v1/reports");

        assertThat(RateLimitInterceptor.selectScope(request)).isEqualTo(RateLimitConfig.SCOPE_API);
    }

    @Test
    void authLikePaths_fallBackToApiScope() {
        var request = new MockHttpServletRequest("POST", "/api/v1/auth/otp");

        assertThat(RateLimitInterceptor.selectScope(request)).isEqualTo(RateLimitConfig.SCOPE_API);
    }

    @Test
    void defaultScopes_coverApiAndReportOnly() {
        assertThat(new RateLimitConfig().getScopes())
                .containsOnlyKeys(RateLimitConfig.SCOPE_API, RateLimitConfig.SCOPE_REPORT);
    }
}
