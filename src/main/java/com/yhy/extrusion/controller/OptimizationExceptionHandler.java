package com.yhy.extrusion.controller;

import com.yhy.extrusion.exception.OptimizationException;
import com.yhy.extrusion.vo.R;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine errors onto the {@link R} envelope: 422 for rejected input, 409 for a cancelled run.
 */
@RestControllerAdvice
public class OptimizationExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(OptimizationExceptionHandler.class);

    @ExceptionHandler(OptimizationException.class)
    public ResponseEntity<R<Map<String, Object>>> handleOptimization(OptimizationException ex) {
        HttpStatus status = ex.isValidationError() ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.CONFLICT;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", ex.getCode());
        body.putAll(ex.details());
        return ResponseEntity.status(status).body(R.failed(status, body, ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<R<Map<String, Object>>> handleInvalidRequest(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(R.failed(HttpStatus.BAD_REQUEST, fields, "Invalid request"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<R<Map<String, Object>>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(R.failed(HttpStatus.BAD_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<R<Map<String, Object>>> handleUnexpected(Exception ex) {
        LOGGER.error("Optimization request failed", ex);
        return ResponseEntity.internalServerError().body(R.failed(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage()));
    }
}
