package decentralabs.gmp.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import decentralabs.gmp.util.LogSanitizer;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for all controllers
 * Provides centralized, consistent error handling
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handles validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "Validation failed");
        response.put("errors", errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handles protocol and state machine rejections
     */
    @ExceptionHandler(GmpException.class)
    public ResponseEntity<Map<String, Object>> handleGmpException(GmpException ex) {
        GmpErrorCode code = ex.getCode();

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("code", code.name());
        response.put("message", ex.getMessage());

        if (code.isDeliveredEquivalent()) {
            log.info("Rejected [{}]: {}", code, LogSanitizer.sanitize(ex.getMessage()));
        } else {
            log.warn("Rejected [{}]: {}", code, LogSanitizer.sanitize(ex.getMessage()));
        }
        return ResponseEntity.status(code.getHttpStatus()).body(response);
    }

    /**
     * Handles malformed hex values, amounts and similar input errors
     */
    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(Exception ex) {

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", ex.getMessage());

        log.warn("Invalid argument: {}", LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handles all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "An unexpected error occurred");

        // Log full stack trace for debugging but don't expose to client
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
