package com.example.logfilter.config;

import com.example.logfilter.filter.FilterValidationException;
import com.example.logfilter.filter.UnsupportedFieldOrOperatorException;
import com.example.logfilter.filter.models.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps filter configuration errors to HTTP responses. Invalid criteria are
 * reported with every error found, not only the first.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public record FilterErrorResponse(String message, List<ValidationError> errors) {
    }

    @ExceptionHandler(FilterValidationException.class)
    public ResponseEntity<FilterErrorResponse> handleFilterValidation(FilterValidationException e) {
        log.warn("Rejected filter request: {}", e.getValidationResult());
        return ResponseEntity.badRequest()
                .body(new FilterErrorResponse("Invalid filter criteria", e.getValidationResult().errors()));
    }

    @ExceptionHandler(UnsupportedFieldOrOperatorException.class)
    public ResponseEntity<Map<String, String>> handleUnsupported(UnsupportedFieldOrOperatorException e) {
        log.debug("Unsupported filter field/operator: {}", e.getMessage());
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        if (e.getField() != null) {
            body.put("field", e.getField());
        }
        if (e.getOperator() != null) {
            body.put("operator", e.getOperator());
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.debug("Request validation failed: {}", errors);
        return ResponseEntity.badRequest().body(errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
