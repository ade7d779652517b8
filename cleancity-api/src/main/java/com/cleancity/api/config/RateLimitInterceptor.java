package com.cleancity.api.config;

import com.cleancity.api.error.ErrorCode;
import com.cleancity.api.error.ErrorResponse;
import com.cleancity.api.ratelimit.RateLimiter;
import com.cleancity.api.ratelimit.RateLimiter.Decision;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Enforces per-IP rate limits and returns 429 with a retry-after when exceeded.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final RateLimitConfig rateLimitConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitInterceptor(RateLimiter rateLimiter, RateLimitConfig rateLimitConfig,
                                ObjectMapper objectMapper, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.rateLimitConfig = rateLimitConfig;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {
        if (!rateLimitConfig.isEnabled()) {
            return true;
        }

        String scope = selectScope(request);
        Decision decision = rateLimiter.tryAcquire(scope, resolveClientIp(request));

        if (decision.allowed()) {
            response.addHeader("X-Rate-Limit-Remaining", String.valueOf(decision.remaining()));
            return true;
        }

        response.setStatus(ErrorCode.RATE_LIMIT_EXCEEDED.getHttpStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.addHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        var body = new ErrorResponse(
                ErrorCode.RATE_LIMIT_EXCEEDED.name(),
                "Too many requests. Retry after " + decision.retryAfterSeconds() + " seconds.",
                Map.of("scope", scope),
                decision.retryAfterSeconds(),
                Instant.now(clock));
        objectMapper.writeValue(response.getWriter(), body);
        return false;
    }

    static String selectScope(HttpServletRequest request) {
        String path = request.getRequestURI();
        if ("POST".equals(request.getMethod()) && path.endsWith("/api/v1/reports")) {
            return RateLimitConfig.SCOPE_REPORT;
        }
        return RateLimitConfig.SCOPE_API;
    }

    private static String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
