package com.programmersdiary.promptalchemy.web;

import com.programmersdiary.promptalchemy.enhance.AdmissionDeniedException;
import com.programmersdiary.promptalchemy.enhance.MissingCredentialException;
import com.programmersdiary.promptalchemy.project.ProjectExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(ProjectExistsException.class)
    public ResponseEntity<Map<String, Object>> handleProjectExists(ProjectExistsException ex) {
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(MissingCredentialException.class)
    public ResponseEntity<Map<String, Object>> handleMissingCredential(MissingCredentialException ex) {
        return respond(HttpStatus.PRECONDITION_FAILED, ex.getMessage());
    }

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAdmissionDenied(AdmissionDeniedException ex) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(UncheckedIOException ex) {
        log.error("I/O failure handling request: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "I/O error: " + ex.getCause().getMessage());
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
