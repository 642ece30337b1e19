package com.affinity.x.monitoring;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Stamps each request with its start time so error responses can report elapsed time too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTimingFilter extends OncePerRequestFilter {
    public static final String START_NANOS_ATTRIBUTE = RequestTimingFilter.class.getName() + ".startNanos";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        request.setAttribute(START_NANOS_ATTRIBUTE, System.nanoTime());
        filterChain.doFilter(request, response);
    }

    public static long elapsedMs(HttpServletRequest request) {
        Object start = request == null ? null : request.getAttribute(START_NANOS_ATTRIBUTE);
        if (!(start instanceof Long startNanos)) {
            return 0L;
        }
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
