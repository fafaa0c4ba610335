package com.tasklens.exception;

import com.tasklens.observability.EventLog;
import com.tasklens.observability.RequestContext;
import com.tasklens.observability.TasklensMetrics;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Turns failures raised below the controllers into {@link ErrorBody} responses.
 * The cause is recorded on the request's {@link RequestContext} so the request summary
 * and span report it; logging of the outcome itself is left to the request filter.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final EventLog events = EventLog.getLogger(GlobalExceptionHandler.class);

    private final TasklensMetrics metrics;

    public GlobalExceptionHandler(TasklensMetrics metrics) {
        this.metrics = metrics;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorBody> handleApiException(ApiException e, HttpServletRequest request) {
        record(request, e);
        ResponseEntity.BodyBuilder response = ResponseEntity.status(e.getStatus());
        if (e.getStatus() == HttpStatus.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return response.body(ErrorBody.of(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorBody> handleValidation(MethodArgumentNotValidException e,
                                                      HttpServletRequest request) {
        record(request, e);
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(ErrorBody.of("VALIDATION_FAILED", message.isEmpty() ? "Invalid request" : message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(HttpMessageNotReadableException e,
                                                      HttpServletRequest request) {
        record(request, e);
        return ResponseEntity.badRequest()
                .body(ErrorBody.of("MALFORMED_REQUEST", "Request body is missing or malformed"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorBody> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                        HttpServletRequest request) {
        record(request, e);
        return ResponseEntity.badRequest()
                .body(ErrorBody.of("INVALID_PARAMETER", "Invalid value for '" + e.getName() + "'"));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorBody> handleAccessDenied(AccessDeniedException e, HttpServletRequest request) {
        record(request, e);
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorBody.of("FORBIDDEN", "Not enough permissions"));
    }

    /**
     * Database unreachable or timing out: the service is degraded rather than broken.
     */
    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<ErrorBody> handleDatabaseUnavailable(DataAccessResourceFailureException e,
                                                               HttpServletRequest request) {
        RequestContext context = record(request, e);
        metrics.recordError("persistence_error", "database");
        events.error(context, "Database unavailable", e, "error", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("SERVICE_UNAVAILABLE", "Database is unavailable"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorBody> handleDataAccess(DataAccessException e, HttpServletRequest request) {
        RequestContext context = record(request, e);
        metrics.recordError("persistence_error", "database");
        events.error(context, "Persistence failure", e, "error", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("INTERNAL_ERROR", "Internal server error"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleUnexpected(Exception e, HttpServletRequest request) {
        RequestContext context = record(request, e);
        if (e instanceof ErrorResponse framework) {
            // Routing and protocol errors raised by Spring MVC keep their own status.
            HttpStatusCode status = framework.getStatusCode();
            HttpStatus known = HttpStatus.resolve(status.value());
            String code = known != null ? known.name() : "HTTP_" + status.value();
            return ResponseEntity.status(status).body(ErrorBody.of(code, e.getMessage()));
        }
        metrics.recordError("unhandled_exception", "api");
        events.error(context, "Unhandled exception", e, "error_type", e.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("INTERNAL_ERROR", "Internal server error"));
    }

    private static RequestContext record(HttpServletRequest request, Throwable failure) {
        RequestContext context = RequestContext.from(request).orElse(null);
        if (context != null) {
            context.recordFailure(failure);
        }
        return context;
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
