package com.brayford.organization.infrastructure.web;

import com.brayford.lifecycle.DeletionAlreadyPendingException;
import com.brayford.lifecycle.InvalidTokenException;
import com.brayford.lifecycle.InvalidTransitionException;
import com.brayford.lifecycle.ResourceNotFoundException;
import com.brayford.lifecycle.TokenExpiredException;
import com.brayford.lifecycle.UndoExpiredException;
import com.brayford.lifecycle.WriteConflictException;
import com.brayford.observability.CorrelationContextHolder;
import com.brayford.security.AccessDeniedException;
import com.brayford.security.BrayfordException;
import com.brayford.security.LastOwnerLockoutException;
import com.brayford.security.PermissionDeniedException;
import com.brayford.security.TenantMismatchException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://brayford.events/errors/token-expired",
 *   "title": "Gone",
 *   "status": 410,
 *   "detail": "Confirmation link has expired. Please request deletion again.",
 *   "errorCode": "token-expired",
 *   "timestamp": "2026-02-02T10:00:01Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Platform exceptions are mapped by their {@link BrayfordException#errorCode()}. Every body
 * carries the correlation ID so support can find the matching log lines.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://brayford.events/errors/";

    @ExceptionHandler(BrayfordException.class)
    public ProblemDetail handlePlatform(BrayfordException ex) {
        HttpStatus status = statusFor(ex.errorCode());
        if (status.is5xxServerError()) {
            log.error("Unmapped platform error {}", ex.errorCode(), ex);
        } else {
            log.warn("Request refused [{}]: {}", ex.errorCode(), ex.getMessage());
        }
        return problem(status, ex.getMessage(), ex.errorCode());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail, "validation");
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request body is missing or malformed", "bad-request");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "internal");
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case PermissionDeniedException.CODE, AccessDeniedException.CODE, TenantMismatchException.CODE ->
                    HttpStatus.FORBIDDEN;
            case LastOwnerLockoutException.CODE, InvalidTransitionException.CODE,
                    DeletionAlreadyPendingException.CODE, WriteConflictException.CODE -> HttpStatus.CONFLICT;
            case TokenExpiredException.CODE, UndoExpiredException.CODE -> HttpStatus.GONE;
            case InvalidTokenException.CODE -> HttpStatus.BAD_REQUEST;
            case ResourceNotFoundException.CODE -> HttpStatus.NOT_FOUND;
            case MissingCallerException.CODE -> HttpStatus.UNAUTHORIZED;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String errorCode) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode));
        problem.setProperty("errorCode", errorCode);
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
