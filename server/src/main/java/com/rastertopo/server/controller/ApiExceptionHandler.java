package com.rastertopo.server.controller;

import com.rastertopo.server.contour.TracerInvariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

    @ExceptionHandler(TracerInvariantException.class)
    public ResponseEntity<String> handleTracerInvariant(TracerInvariantException ex) {
        log.error("Contour tracer invariant violated", ex);
        return ResponseEntity.internalServerError().body("Contour tracing failed: " + ex.getMessage());
    }
}
