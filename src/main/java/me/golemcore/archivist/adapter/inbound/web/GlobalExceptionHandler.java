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

package me.golemcore.archivist.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.archivist.domain.exception.ArchiveRecordNotFoundException;
import me.golemcore.archivist.domain.exception.ConsolidationValidationException;
import me.golemcore.archivist.domain.exception.FileNotTrackedException;
import me.golemcore.archivist.domain.exception.RegistrationConflictException;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps the archivist error taxonomy to HTTP status codes for all API
 * controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.archivist.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({ FileNotTrackedException.class, ArchiveRecordNotFoundException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(RuntimeException ex) {
        log.debug("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(RegistrationConflictException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConflict(RegistrationConflictException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ConsolidationValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleValidation(ConsolidationValidationException ex) {
        log.warn("[API] Validation failed: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler(StorageFailureException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStorageFailure(StorageFailureException ex) {
        log.error("[API] Storage failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
