package com.brayford.organization.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.brayford.lifecycle.DeletionAlreadyPendingException;
import com.brayford.lifecycle.DeletionStatus;
import com.brayford.lifecycle.InvalidTokenException;
import com.brayford.lifecycle.InvalidTransitionException;
import com.brayford.lifecycle.ResourceNotFoundException;
import com.brayford.lifecycle.TokenExpiredException;
import com.brayford.lifecycle.UndoExpiredException;
import com.brayford.lifecycle.WriteConflictException;
import com.brayford.observability.CorrelationContext;
import com.brayford.observability.CorrelationContextHolder;
import com.brayford.security.AccessDeniedException;
import com.brayford.security.LastOwnerLockoutException;
import com.brayford.security.OrganizationRole;
import com.brayford.security.PermissionDeniedException;
import com.brayford.security.Permissions;
import com.brayford.security.TenantMismatchException;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("platform errors")
    class PlatformErrors {

        @Test
        @DisplayName("authorization failures are 403")
        void forbidden() {
            assertThat(handler.handlePlatform(
                    PermissionDeniedException.missing(OrganizationRole.ADMIN, Permissions.ORG_DELETE)).getStatus())
                    .isEqualTo(403);
            assertThat(handler.handlePlatform(new AccessDeniedException(OrganizationRole.MEMBER, "b-1")).getStatus())
                    .isEqualTo(403);
            assertThat(handler.handlePlatform(new TenantMismatchException("org-a", "org-b")).getStatus())
                    .isEqualTo(403);
        }

        @Test
        @DisplayName("state conflicts are 409")
        void conflicts() {
            assertThat(handler.handlePlatform(new LastOwnerLockoutException("org", "u", 1)).getStatus()).isEqualTo(409);
            assertThat(handler.handlePlatform(
                    new InvalidTransitionException("r", DeletionStatus.CANCELLED, "confirm")).getStatus()).isEqualTo(409);
            assertThat(handler.handlePlatform(
                    new DeletionAlreadyPendingException("org", "r", DeletionStatus.PENDING_EMAIL)).getStatus())
                    .isEqualTo(409);
            assertThat(handler.handlePlatform(new WriteConflictException("r", 3)).getStatus()).isEqualTo(409);
        }

        @Test
        @DisplayName("expired links are 410 Gone")
        void gone() {
            ProblemDetail problem = handler.handlePlatform(new TokenExpiredException("r", Instant.EPOCH));

            assertThat(problem.getStatus()).isEqualTo(410);
            assertThat(problem.getProperties()).containsEntry("errorCode", "token-expired");
            assertThat(problem.getType().toString()).endsWith("/errors/token-expired");
            assertThat(handler.handlePlatform(new UndoExpiredException("r", null)).getStatus()).isEqualTo(410);
        }

        @Test
        @DisplayName("bad tokens, missing resources and missing callers")
        void otherMappings() {
            assertThat(handler.handlePlatform(new InvalidTokenException("r", "undo")).getStatus()).isEqualTo(400);
            assertThat(handler.handlePlatform(new ResourceNotFoundException("member", "m")).getStatus()).isEqualTo(404);
            assertThat(handler.handlePlatform(new MissingCallerException("missing")).getStatus()).isEqualTo(401);
        }

        @Test
        @DisplayName("an unknown error code is a 500")
        void unknownCode() {
            assertThat(GlobalExceptionHandler.statusFor("something-new").value()).isEqualTo(500);
        }
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps generic Exception to 500 without leaking the message")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("db password is hunter2"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("hunter2");
    }

    @Test
    @DisplayName("error responses carry timestamp and correlation ID")
    void includesTimestampAndCorrelation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-42", null, null, null));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-42");
    }
}
