package com.delta.synctracker.sync.ratelimit;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.model.RateLimitDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies {@link InboundRateLimiter} to every request except the configured exempt paths.
 * Callers are partitioned by authenticated principal when there is one, else by remote address.
 */
public class RateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final InboundRateLimiter rateLimiter;
    private final SyncTrackerProperties properties;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(InboundRateLimiter rateLimiter, SyncTrackerProperties properties, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        for (String exempt : properties.getRateLimiting().getExemptPaths()) {
            if (path.equals(exempt) || path.startsWith(exempt + "/")) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String partitionKey = partitionKey(request);
        RateLimitDecision decision = rateLimiter.admit(partitionKey);
        if (decision.allowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        long retryAfterSeconds = decision.retryAfterSeconds();
        log.warn("Rate limited {} on {} {}; retry after {}s", partitionKey, request.getMethod(), request.getRequestURI(), retryAfterSeconds);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "rate_limited");
        body.put("message", "Too many requests; retry after " + retryAfterSeconds + " seconds");
        body.put("retryAfterSeconds", retryAfterSeconds);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    static String partitionKey(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return "user:" + principal.getName();
        }
        return "ip:" + request.getRemoteAddr();
    }
}
