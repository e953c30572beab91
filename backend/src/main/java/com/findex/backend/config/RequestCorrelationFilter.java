package com.findex.backend.config;

import com.findex.backend.util.MdcKeys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts request and correlation ids into the MDC and echoes them back. The
 * correlation id is handed on to asynchronous export runs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = getOrCreate(request.getHeader(REQUEST_ID_HEADER));
        String correlationId = getOrCreate(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(MdcKeys.REQUEST_ID, requestId);
        MDC.put(MdcKeys.CORRELATION_ID, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MdcKeys.REQUEST_ID);
            MDC.remove(MdcKeys.CORRELATION_ID);
        }
    }

    private String getOrCreate(String value) {
        return (value == null || value.isBlank()) ? UUID.randomUUID().toString() : value;
    }
}
