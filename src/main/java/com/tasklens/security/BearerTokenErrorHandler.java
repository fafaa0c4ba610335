package com.tasklens.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklens.exception.ErrorBody;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes security failures as {@link ErrorBody} JSON.
 * <ul>
 *   <li>no bearer credentials: 403 {@code NOT_AUTHENTICATED}</li>
 *   <li>bearer token present but invalid or expired: 401 {@code INVALID_TOKEN} with
 *       {@code WWW-Authenticate: Bearer}</li>
 *   <li>authenticated but lacking a scope: 403 {@code FORBIDDEN}</li>
 * </ul>
 */
@Component
public class BearerTokenErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final String BEARER_PREFIX = "bearer ";

    private final ObjectMapper objectMapper;

    public BearerTokenErrorHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        if (hasBearerToken(request)) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            write(response, HttpStatus.UNAUTHORIZED,
                    ErrorBody.of("INVALID_TOKEN", "Could not validate credentials"));
        } else {
            write(response, HttpStatus.FORBIDDEN,
                    ErrorBody.of("NOT_AUTHENTICATED", "Not authenticated"));
        }
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        write(response, HttpStatus.FORBIDDEN, ErrorBody.of("FORBIDDEN", "Not enough permissions"));
    }

    static boolean hasBearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        return header != null && header.length() > BEARER_PREFIX.length()
                && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length());
    }

    private void write(HttpServletResponse response, HttpStatus status, ErrorBody body) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        OutputStream out = response.getOutputStream();
        objectMapper.writeValue(out, body);
        out.flush();
    }
}
