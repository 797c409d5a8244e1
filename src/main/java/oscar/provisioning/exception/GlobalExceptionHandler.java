package oscar.provisioning.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for all controllers
 * Maps provisioning failures to the status owned by their kind
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
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "The service specification is not valid");
        response.put("kind", ErrorKind.INVALID_SPECIFICATION.name());
        response.put("errors", errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handles unparseable request bodies
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableMessage(
            HttpMessageNotReadableException ex) {

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "The service specification is not valid: " + ex.getMostSpecificCause().getMessage());
        response.put("kind", ErrorKind.INVALID_SPECIFICATION.name());

        log.warn("Unreadable service specification: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handles provisioning failures
     */
    @ExceptionHandler(ProvisioningException.class)
    public ResponseEntity<Map<String, Object>> handleProvisioningException(
            ProvisioningException ex) {

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", ex.getMessage());
        response.put("kind", ex.getKind().name());
        if (ex.getProviderKind() != null) {
            response.put("providerKind", ex.getProviderKind());
        }
        if (ex.getProviderId() != null) {
            response.put("providerId", ex.getProviderId());
        }

        if (ex.getKind().isClientError()) {
            log.warn("Service creation rejected [{}]: {}", ex.getKind(), ex.getMessage());
        } else {
            log.error("Service creation failed [{}]: {}", ex.getKind(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(ex.getKind().getStatus()).body(response);
    }

    /**
     * Handles all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
            Exception ex) {

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "An unexpected error occurred");

        // Log full stack trace for debugging but don't expose to client
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
