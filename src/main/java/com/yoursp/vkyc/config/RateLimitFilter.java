package com.yoursp.vkyc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Sliding window rate limiter using Redis ZADD + ZREMRANGEBYSCORE.
 * <p>
 * Guards the endpoints reachable with nothing but a link token: link
 * resolution and session creation. Keyed by client IP.
 * </p>
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${rate-limit.enabled:true}")
    private boolean enabled;

    public RateLimitFilter(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws ServletException, IOException {
        if (!enabled) {
            chain.doFilter(request, response);
            return;
        }

        RateLimitConfig config = resolveConfig(request.getMethod(), request.getRequestURI());
        if (config == null) {
            chain.doFilter(request, response);
            return;
        }

        String key = "ratelimit:" + config.endpointKey() + ":" + resolveClientIp(request);
        if (isRateLimited(key, config.maxRequests(), config.windowSeconds())) {
            log.warn("Rate limited: key={}, path={}", key, request.getRequestURI());
            response.setStatus(429);
            response.setHeader("Retry-After", String.valueOf(config.windowSeconds()));
            response.setContentType("application/json");
            response.getWriter().write(objectMapper.writeValueAsString(Map.of(
                    "error", "RATE_LIMITED",
                    "message", "Too many requests. Try again later.",
                    "retryAfterSeconds", config.windowSeconds())));
            return;
        }

        chain.doFilter(request, response);
    }

    boolean isRateLimited(String key, int maxRequests, int windowSeconds) {
        try {
            double now = Instant.now().toEpochMilli();
            double windowStart = now - (windowSeconds * 1000.0);

            // Remove expired entries
            redisTemplate.opsForZSet().removeRangeByScore(key, 0, windowStart);

            Long count = redisTemplate.opsForZSet().zCard(key);
            if (count != null && count >= maxRequests) {
                return true;
            }

            redisTemplate.opsForZSet().add(key, String.valueOf(now), now);
            redisTemplate.expire(key, Duration.ofSeconds(windowSeconds + 10L));
            return false;
        } catch (RuntimeException e) {
            // On Redis failure, allow the request (fail-open)
            log.warn("Rate limit check failed (allowing request): {}", e.getMessage());
            return false;
        }
    }

    RateLimitConfig resolveConfig(String method, String path) {
        if ("GET".equals(method) && path.startsWith("/api/vkyc/links/")) {
            return new RateLimitConfig("link_resolve", 30, 60);
        } else if ("POST".equals(method) && path.equals("/api/vkyc/sessions")) {
            return new RateLimitConfig("session_create", 10, 60);
        }
        return null;
    }

    private String resolveClientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    record RateLimitConfig(String endpointKey, int maxRequests, int windowSeconds) {
    }
}
