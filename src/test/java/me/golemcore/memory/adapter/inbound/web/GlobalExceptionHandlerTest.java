package me.golemcore.memory.adapter.inbound.web;

import me.golemcore.memory.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.memory.domain.exception.DeadlineExceededException;
import me.golemcore.memory.domain.exception.ErrorKind;
import me.golemcore.memory.domain.exception.InsufficientHistoryException;
import me.golemcore.memory.domain.exception.MemoryConflictException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.exception.QuotaExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapNotFound() {
        StepVerifier.create(handler.handleMemoryStore(new MemoryNotFoundException("Memory not found: k")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("not_found", body.getError());
                    assertEquals("Memory not found: k", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapConflictWithCurrentState() {
        MemoryConflictException ex = new MemoryConflictException("Revision mismatch",
                Map.of("currentRevision", 4L, "currentContent", "server"));

        StepVerifier.create(handler.handleMemoryStore(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals("server", response.getBody().getDetails().get("currentContent"));
                })
                .verifyComplete();
    }

    @Test
    void shouldMapQuotaExceededToForbidden() {
        StepVerifier.create(handler.handleMemoryStore(new QuotaExceededException(500, 500)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
                    assertEquals("quota_exceeded", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapInsufficientHistoryToBadRequest() {
        StepVerifier.create(handler.handleMemoryStore(new InsufficientHistoryException("k", 1, 3)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(3, response.getBody().getDetails().get("requestedSteps"));
                })
                .verifyComplete();
    }

    @Test
    void shouldMapDeadlineToGatewayTimeout() {
        DeadlineExceededException ex = new DeadlineExceededException("rollback", Instant.parse("2026-01-01T00:00:00Z"));

        StepVerifier.create(handler.handleMemoryStore(ex))
                .assertNext(response -> assertEquals(HttpStatus.GATEWAY_TIMEOUT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldCoverEveryErrorKind() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertNotNull(GlobalExceptionHandler.statusOf(kind));
        }
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "No such route");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals(404, response.getBody().getStatus());
                    assertEquals("No such route", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalArgumentException() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Path escapes storage root")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("invalid_argument", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("Corrupt memories document")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
