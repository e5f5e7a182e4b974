package com.flagship.trade_ledger.observability;

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

/**
 * Servlet filter that tags every HTTP request with a correlation ID.
 *
 * For each request this filter:
 * 1. Reads the X-Correlation-ID header
 * 2. Generates an ID when the header is missing or blank
 * 3. Puts the ID in MDC so every log line of the request carries it
 * 4. Echoes the ID on the response
 * 5. Clears the thread-local and the MDC keys once the request completes,
 *    including the voucher and account keys set further down the call
 *
 * Runs at HIGHEST_PRECEDENCE, ahead of every other filter.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            // Caller's ID wins, otherwise a fresh one
            String correlationId = extractOrGenerateCorrelationId(request);

            // Thread-local for code that reads it directly
            CorrelationContext.setCorrelationId(correlationId);

            // MDC for the log pattern
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);

            // Echo on the response for client-side correlation
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);

        } finally {
            // Pooled threads must not leak IDs into the next request
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private String extractOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);

        if (correlationId == null || correlationId.isBlank()) {
            correlationId = CorrelationContext.generateCorrelationId();
        }

        return correlationId;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Actuator scrapes are noise
        return request.getRequestURI().startsWith("/actuator");
    }
}
