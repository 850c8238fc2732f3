package com.registry.api.web;

import com.registry.engine.logging.LoggingContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Gives every request a trace ID (caller-supplied or generated), echoes it back,
 * and clears the logging context afterwards.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTracingFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Trace-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        try {
            LoggingContext.setTraceId(request.getHeader(TRACE_HEADER));
            response.setHeader(TRACE_HEADER, LoggingContext.ensureTraceId());
            chain.doFilter(request, response);
        } finally {
            LoggingContext.clearAll();
        }
    }
}
