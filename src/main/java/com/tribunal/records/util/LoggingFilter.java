package com.tribunal.records.util;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every API request with a request id and correlation id in the MDC
 * and echoes both ids back as response headers.
 */
@Component
@Order(0)
public class LoggingFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(LoggingFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String REQUEST_ID_KEY = "requestId";
    static final String CORRELATION_ID_KEY = "correlationId";
    private static final String METHOD_KEY = "method";
    private static final String URI_KEY = "uri";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (!StringUtils.hasText(correlationId)) {
            correlationId = requestId;
        }

        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        MDC.put(METHOD_KEY, request.getMethod());
        MDC.put(URI_KEY, request.getRequestURI());

        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        long started = System.currentTimeMillis();
        try {
            filterChain.doFilter(request, response);
        } finally {
            logger.debug("{} {} -> {} in {} ms", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), System.currentTimeMillis() - started);
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(CORRELATION_ID_KEY);
            MDC.remove(METHOD_KEY);
            MDC.remove(URI_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }
}
