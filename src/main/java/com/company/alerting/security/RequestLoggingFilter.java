package com.company.alerting.security;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Request id and caller in MDC for log correlation, plus per-route request timing.
 * Runs after the security chain so the caller is already authenticated.
 */
@Component
@Order(SecurityProperties.DEFAULT_FILTER_ORDER + 1)
@Slf4j
@RequiredArgsConstructor
public class RequestLoggingFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID_KEY = "requestId";
    static final String MDC_CALLER_KEY = "caller";

    // Caller-supplied ids end up in every log line
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private final CallerContext callerContext;
    private final MeterRegistry meterRegistry;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        String route = route(httpRequest.getRequestURI());

        if (route == null) {
            chain.doFilter(request, response);
            return;
        }

        String requestId = httpRequest.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || !SAFE_REQUEST_ID.matcher(requestId).matches()) {
            requestId = UUID.randomUUID().toString();
        }

        MDC.put(MDC_REQUEST_ID_KEY, requestId);
        MDC.put(MDC_CALLER_KEY, callerContext.getCurrentCallerId());
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);

        long start = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            long elapsed = System.nanoTime() - start;
            Timer.builder("alerts.http.requests")
                    .tag("route", route)
                    .tag("method", httpRequest.getMethod())
                    .tag("status", String.valueOf(httpResponse.getStatus()))
                    .register(meterRegistry)
                    .record(elapsed, TimeUnit.NANOSECONDS);

            if ("ingest".equals(route) || httpResponse.getStatus() >= 400) {
                log.info("{} {} -> {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), TimeUnit.NANOSECONDS.toMillis(elapsed));
            } else {
                log.debug("{} {} -> {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), TimeUnit.NANOSECONDS.toMillis(elapsed));
            }
            MDC.remove(MDC_REQUEST_ID_KEY);
            MDC.remove(MDC_CALLER_KEY);
        }
    }

    /**
     * Metric route for an engine API path; null for anything else (actuator, docs).
     */
    static String route(String uri) {
        if (uri == null || !uri.startsWith("/api/v1/")) {
            return null;
        }
        if (uri.startsWith("/api/v1/alerts")) {
            return "ingest";
        }
        if (uri.startsWith("/api/v1/dead-letters")) {
            return uri.endsWith("/replay") ? "replay" : "dead-letters";
        }
        if (uri.startsWith("/api/v1/health")) {
            return "health";
        }
        return "other";
    }
}
