package com.eainde.fitengine.web;

import com.eainde.fitengine.exception.ConfigurationWriteRejectedException;
import com.eainde.fitengine.exception.FitEngineException;
import com.eainde.fitengine.exception.InputValidationException;
import com.eainde.fitengine.exception.IntegrityException;
import com.eainde.fitengine.exception.NarrativeGenerationException;
import com.eainde.fitengine.exception.SessionAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine failures to JSON error bodies. Integrity failures are never downgraded: they
 * surface as 500 with their own code.
 */
@Slf4j
@RestControllerAdvice
public class FitAnalysisExceptionAdvice {

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInput(InputValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(IntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(IntegrityException ex) {
        log.error("Integrity failure in session {}", ex.getSessionId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(NarrativeGenerationException.class)
    public ResponseEntity<Map<String, Object>> handleGeneration(NarrativeGenerationException ex) {
        log.warn("Narrative generation failed in session {}: {}", ex.getSessionId(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(SessionAccessException.class)
    public ResponseEntity<Map<String, Object>> handleSession(SessionAccessException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ConfigurationWriteRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleConfigurationWrite(ConfigurationWriteRejectedException ex) {
        return respond(HttpStatus.FORBIDDEN, ex);
    }

    @ExceptionHandler(FitEngineException.class)
    public ResponseEntity<Map<String, Object>> handleOther(FitEngineException ex) {
        log.error("Unmapped engine failure in session {}", ex.getSessionId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "invalid_input", message, null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(body(HttpStatus.BAD_REQUEST, "invalid_input", "Request body could not be read", null));
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, FitEngineException ex) {
        return ResponseEntity.status(status).body(body(status, ex.getCode(), ex.getMessage(), ex.getSessionId()));
    }

    static Map<String, Object> body(HttpStatus status, String code, String message, String sessionId) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp", Instant.now().toString());
        out.put("status", status.value());
        out.put("code", code);
        out.put("message", message);
        if (sessionId != null) {
            out.put("sessionId", sessionId);
        }
        return out;
    }
}
