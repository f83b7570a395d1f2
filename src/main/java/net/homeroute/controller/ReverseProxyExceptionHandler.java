package net.homeroute.controller;

import net.homeroute.controller.support.ResponseBodies;
import net.homeroute.exception.ReferentialIntegrityException;
import net.homeroute.exception.RegistryStorageException;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.exception.StaleRegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps registry exceptions to response bodies. Validation failures are
 * reported in the body with HTTP 200 so the dashboard can show the message inline.
 */
@RestControllerAdvice(assignableTypes = {
    HostController.class,
    EnvironmentController.class,
    ApplicationController.class,
    ReverseProxyController.class
})
public class ReverseProxyExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReverseProxyExceptionHandler.class);

    @ExceptionHandler(ReferentialIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleReferentialIntegrity(ReferentialIntegrityException ex) {
        Map<String, Object> body = ResponseBodies.failure(ex.getMessage());
        body.put("referencingApplications", ex.getReferenceCount());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(RegistryValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(RegistryValidationException ex) {
        return ResponseEntity.ok(ResponseBodies.failure(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request body", ex);
        return ResponseEntity.ok(ResponseBodies.failure("Invalid request body"));
    }

    @ExceptionHandler(StaleRegistryException.class)
    public ResponseEntity<Map<String, Object>> handleStale(StaleRegistryException ex) {
        log.warn("Rejected stale registry write: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ResponseBodies.failure(ex.getMessage()));
    }

    @ExceptionHandler(RegistryStorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(RegistryStorageException ex) {
        log.error("Registry storage failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ResponseBodies.failure(ex.getMessage()));
    }
}
