package com.flagship.equipment_booking.observability;

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
 * Servlet filter that sets up per-request context.
 *
 * This filter:
 * 1. Extracts the correlation ID from X-Correlation-ID or generates one
 * 2. Puts it in MDC and echoes it on the response
 * 3. Captures the acting user from X-Actor-Id / X-Actor-Name
 * 4. Cleans up thread-locals and MDC after the request completes
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
            String correlationId = extractOrGenerateCorrelationId(request);

            CorrelationContext.setCorrelationId(correlationId);
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            ActorContext.set(
                request.getHeader(ActorContext.ACTOR_ID_HEADER),
                request.getHeader(ActorContext.ACTOR_NAME_HEADER));

            filterChain.doFilter(request, response);

        } finally {
            CorrelationContext.clear();
            ActorContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.BOOKING_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ASSET_ID_MDC_KEY);
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
        // Actuator probes are too noisy to trace
        String path = request.getRequestURI();
        return path.startsWith("/actuator");
    }
}
