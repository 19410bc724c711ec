package me.golemcore.memory.adapter.inbound.web;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.memory.domain.exception.ErrorKind;
import me.golemcore.memory.domain.exception.MemoryStoreException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;

/**
 * Turns failures raised by the memory controllers into {@link ApiErrorResponse}
 * bodies. Domain errors keep their kind and details; anything unexpected
 * becomes an opaque 500.
 */
@ControllerAdvice(basePackages = "me.golemcore.memory.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    private static final String INVALID_ARGUMENT = "invalid_argument";

    @ExceptionHandler(MemoryStoreException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleMemoryStore(MemoryStoreException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        } else {
            log.debug("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        }
        return reply(status, ex.getKind().name().toLowerCase(Locale.ROOT), ex.getMessage(), ex.getDetails());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInput(ServerWebInputException ex) {
        log.warn("[API] Unreadable request: {}", ex.getReason());
        return reply(HttpStatus.BAD_REQUEST, INVALID_ARGUMENT, ex.getReason(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return reply(status, null, ex.getReason(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Rejected argument: {}", ex.getMessage());
        return reply(HttpStatus.BAD_REQUEST, INVALID_ARGUMENT, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Unhandled failure", ex);
        return reply(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal server error", null);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
        case NOT_FOUND -> HttpStatus.NOT_FOUND;
        case CONFLICT -> HttpStatus.CONFLICT;
        case QUOTA_EXCEEDED, FORBIDDEN -> HttpStatus.FORBIDDEN;
        case INSUFFICIENT_HISTORY, INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
        case DEADLINE_EXCEEDED -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> reply(HttpStatus status, String error, String message,
            Map<String, Object> details) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
