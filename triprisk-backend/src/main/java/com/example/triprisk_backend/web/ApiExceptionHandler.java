package com.example.triprisk_backend.web;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.upstream.UpstreamUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/** JSON error bodies for the REST controllers. Unknown jobs surface as ResponseStatusException (404). */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final TripProps props;

    public ApiExceptionHandler(TripProps props) {
        this.props = props;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex, HttpServletRequest request) {
        log.debug("Rejected {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, ex, request));
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<Map<String, Object>> upstream(UpstreamUnavailableException ex, HttpServletRequest request) {
        log.warn("Upstream failure on {}: {}", request.getRequestURI(), ex.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body(HttpStatus.SERVICE_UNAVAILABLE, ex, request));
    }

    private Map<String, Object> body(HttpStatus status, Exception ex, HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.value());
        out.put("error", status.getReasonPhrase());
        out.put("message", ex.getMessage());
        out.put("path", request.getRequestURI());
        out.put("timestamp", OffsetDateTime.now(props.zone()).toString());
        return out;
    }
}
