package com.flagship.claims_ledger.observability;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the request's correlation ID, and the vault ID of vault-scoped paths,
 * into the MDC. The correlation ID is echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern VAULT_PATH = Pattern.compile("^/api/vaults/([0-9a-fA-F-]{36})(/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        try {
            String correlationId = CorrelationContext.begin(
                    request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
            Matcher vault = VAULT_PATH.matcher(request.getRequestURI());
            if (vault.matches()) {
                MDC.put(CorrelationContext.VAULT_ID_MDC_KEY, vault.group(1));
            }
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.startsWith("/actuator") || uri.equals("/health");
    }
}
