package com.crosspost.platform.scheduler.controller;

import com.crosspost.platform.connector.exception.PublishValidationException;
import com.crosspost.platform.scheduler.dto.ApiErrorResponse;
import com.crosspost.platform.scheduler.exception.PostNotFoundException;
import com.crosspost.platform.scheduler.exception.ScheduleRuleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(PublishValidationException.class)
    public ResponseEntity<ApiErrorResponse> handlePublishValidation(PublishValidationException ex) {
        return ResponseEntity.badRequest()
                .body(ApiErrorResponse.builder().error(ex.getMessage()).code(ex.getError().name()).build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(ApiErrorResponse.builder()
                        .error(detail.isEmpty() ? "Validation failed" : "Validation failed: " + detail)
                        .code("INVALID_REQUEST")
                        .build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(ApiErrorResponse.builder().error(ex.getMessage()).code("INVALID_REQUEST").build());
    }

    @ExceptionHandler(PostNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(PostNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiErrorResponse.builder().error(ex.getMessage()).code("POST_NOT_FOUND").build());
    }

    @ExceptionHandler(ScheduleRuleException.class)
    public ResponseEntity<ApiErrorResponse> handleScheduleRule(ScheduleRuleException ex) {
        log.debug("Schedule request rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiErrorResponse.builder().error(ex.getMessage()).code("SCHEDULE_RULE").build());
    }
}
