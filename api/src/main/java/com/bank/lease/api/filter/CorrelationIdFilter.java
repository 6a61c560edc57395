package com.bank.lease.api.filter;

import com.bank.lease.application.service.CorrelationIdService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the caller's correlation id (or a fresh one) and, for lease-scoped paths, the lease id
 * into the logging MDC for the duration of the request. The correlation id is echoed on every response.
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern LEASE_PATH = Pattern.compile("^/api/leases/([^/]+)(?:/.*)?$");

    private final CorrelationIdService correlationIdService;

    public CorrelationIdFilter(CorrelationIdService correlationIdService) {
        this.correlationIdService = correlationIdService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (StringUtils.hasText(correlationId)) {
            correlationIdService.setCorrelationId(correlationId);
        } else {
            correlationId = correlationIdService.generateCorrelationId();
        }
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        String leaseId = leaseIdOf(request);
        if (leaseId != null) {
            correlationIdService.setDocumentContext(null, leaseId);
        }
        try {
            log.debug("{} {}", request.getMethod(), request.getRequestURI());
            filterChain.doFilter(request, response);
        } finally {
            correlationIdService.clear();
        }
    }

    /**
     * Lease id from /api/leases/{leaseId}/**, or null for any other path
     */
    static String leaseIdOf(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        Matcher matcher = LEASE_PATH.matcher(path);
        return matcher.matches() ? matcher.group(1) : null;
    }
}
