package com.tasklens.security;

import com.tasklens.audit.AuditLog;
import com.tasklens.audit.AuditService;
import com.tasklens.observability.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Records rejected authentication (401) and authorization (403) outcomes as audit rows.
 * Sits in the security chain ahead of bearer token processing so it sees the responses
 * written by {@link BearerTokenErrorHandler}. Not a bean: it is only installed in the chain.
 */
public class AuthFailureAuditFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFailureAuditFilter.class);

    private final AuditService auditService;

    public AuthFailureAuditFilter(AuditService auditService) {
        this.auditService = auditService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        filterChain.doFilter(request, response);

        int status = response.getStatus();
        if (status != 401 && status != 403) {
            return;
        }
        RequestContext context = RequestContext.from(request).orElse(null);
        if (context == null) {
            return;
        }
        String action = status == 401 ? AuditLog.ACTION_AUTH_FAILED : AuditLog.ACTION_AUTH_DENIED;
        try {
            auditService.recordAuthFailure(context, action, status);
        } catch (RuntimeException e) {
            // The security response has already been written; an audit failure must not replace it
            log.warn("Failed to write audit log for {} {}: {}", request.getMethod(), request.getRequestURI(),
                    e.getMessage());
        }
    }
}
