package com.baykanat.socialsync.api.exception;

import com.baykanat.socialsync.domain.error.PermissionDeniedException;
import com.baykanat.socialsync.domain.error.ResourceNotFoundException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent ve kuyruk uçlarının hata sözleşmesi: 400 validasyon/iş kuralı, 403 izin, 404 kayıt yok, 500 diğer.
 * Gövde her durumda {timestamp, status, error, message, details?}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String VALIDATION_FAILED = "Validation failed";

    /** Gövde alanı validasyonu (agent_id, queue_id, permission_id...) → 400. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<Map<String, String>> fields = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> violation(fe.getField(), fe.getDefaultMessage()))
                .toList();
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, fields);
    }

    /** Query parametresi sınırları (ör. dlq limit 1..200) → 400. */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidParameter(ConstraintViolationException ex) {
        List<Map<String, String>> params = ex.getConstraintViolations().stream()
                .map(cv -> violation(cv.getPropertyPath().toString(), cv.getMessage()))
                .toList();
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, params);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return respond(HttpStatus.BAD_REQUEST, "Missing required parameter: " + ex.getParameterName(), null);
    }

    /** JSON parse hatası, yanlış tipte queue_id veya limit → 400. */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleMalformed(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request", null);
    }

    /** Ön koşul ihlali (ör. medyasız UGC) → 400. */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handlePreconditionFailed(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    /** Repost izni granted değil → 403. */
    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> handlePermissionDenied(PermissionDeniedException ex) {
        log.info("Permission denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ex.getMessage(), null);
    }

    /** Kuyruk satırı, izin veya UGC kaydı yok → 404. */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    /** Beklenmeyen hatalar → 500; ayrıntı sadece loga yazılır. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null);
    }

    private static Map<String, String> violation(String field, String message) {
        return Map.of("field", field, "message", message != null ? message : "Invalid value");
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return ResponseEntity.status(status).body(body);
    }
}
