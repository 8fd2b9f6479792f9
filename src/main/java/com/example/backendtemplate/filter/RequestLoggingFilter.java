package com.example.backendtemplate.filter;

import com.example.backendtemplate.dto.ApiResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logs every request and its response.
 * <p>
 * Request and correlation ids are taken from the incoming headers or generated,
 * put in the MDC for the duration of the request and echoed on the response.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        var requestId = headerOrRandom(request, REQUEST_ID_HEADER);
        var correlationId = headerOrRandom(request, CORRELATION_ID_HEADER);

        MDC.put(ApiResponse.REQUEST_ID_MDC_KEY, requestId);
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        var path = request.getQueryString() != null
                ? request.getRequestURI() + "?" + request.getQueryString()
                : request.getRequestURI();
        var start = System.nanoTime();
        log.info("Incoming request: {} {} from {} | Correlation ID: {}",
                request.getMethod(), path, request.getRemoteAddr(), correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            var elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            log.info("Outgoing response: {} {} - Status: {} - Time: {}ms",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), String.format("%.2f", elapsedMs));
            MDC.remove(ApiResponse.REQUEST_ID_MDC_KEY);
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    private static String headerOrRandom(HttpServletRequest request, String header) {
        var value = request.getHeader(header);
        return StringUtils.hasText(value) ? value : UUID.randomUUID().toString();
    }
}
