package com.sonet.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * One log line per API request, with requestId/method/uri/userId in the MDC while it runs.
 */
@Slf4j
@Component
public class AccessLogFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String USER_ID_HEADER = "X-User-ID";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long start = System.nanoTime();

        String rid = Optional.ofNullable(req.getHeader(REQUEST_ID_HEADER))
                .filter(s -> !s.isBlank())
                .orElseGet(() -> UUID.randomUUID().toString());
        MDC.put("requestId", rid);
        MDC.put("method", req.getMethod());
        MDC.put("uri", buildFullUri(req));
        String userId = req.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            MDC.put("userId", userId);
        }
        res.setHeader(REQUEST_ID_HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            log.info("access method={} uri={} status={} latencyMs={}",
                    req.getMethod(), buildFullUri(req), res.getStatus(), latencyMs);
            MDC.clear();
        }
    }

    private String buildFullUri(HttpServletRequest req) {
        String qs = req.getQueryString();
        return (qs == null || qs.isBlank())
                ? req.getRequestURI()
                : req.getRequestURI() + "?" + qs;
    }
}
