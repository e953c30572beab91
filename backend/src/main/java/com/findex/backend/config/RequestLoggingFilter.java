package com.findex.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Component
@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            // status polling is frequent while an export runs
            if (isStatusPoll(request)) {
                log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), durationMs);
            } else {
                log.info("HTTP {} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), durationMs);
            }
        }
    }

    private boolean isStatusPoll(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return "GET".equals(request.getMethod())
                && uri.startsWith("/api/export/")
                && !uri.endsWith("/download");
    }
}
