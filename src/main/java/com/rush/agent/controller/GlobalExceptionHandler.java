package com.rush.agent.controller;

import com.rush.agent.service.DuplicateSessionException;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @Data
    @Builder
    public static class ErrorResponse {
        private String code;
        private String message;
        private OffsetDateTime timestamp;
    }

    @ExceptionHandler(DuplicateSessionException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateSession(DuplicateSessionException e) {
        log.warn("Rejected session start: {}", e.getMessage());
        ErrorResponse error = ErrorResponse.builder()
            .code("DUPLICATE_SESSION")
            .message(e.getMessage())
            .timestamp(OffsetDateTime.now())
            .build();
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }
}
