package ph.hardwareerp.common.infrastructure;

import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import ph.hardwareerp.common.dto.ApiResponse;
import ph.hardwareerp.common.exception.ExternalServiceException;
import ph.hardwareerp.common.exception.HardwareErpException;
import ph.hardwareerp.common.exception.PaymentAlreadyProcessedException;
import ph.hardwareerp.common.exception.ResourceNotFoundException;
import ph.hardwareerp.common.exception.ValidationException;

import java.util.stream.Collectors;

/**
 * Global exception handler for all services.
 * Converts exceptions to standardized API responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * If the body was already written we must not attempt another response.
     */
    private boolean isResponseCommitted() {
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletResponse response = attrs.getResponse();
            return response != null && response.isCommitted();
        }
        return false;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Resource not found: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(PaymentAlreadyProcessedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAlreadyProcessed(PaymentAlreadyProcessedException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Reconciliation conflict: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write validation errors");
            return null;
        }
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));

        log.warn("Validation errors: {}", errors);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(errors, "HW_ERR_400"));
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ApiResponse<Void>> handleExternalServiceException(ExternalServiceException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.error("External service error: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(HardwareErpException.class)
    public ResponseEntity<ApiResponse<Void>> handleHardwareErpException(HardwareErpException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.error("Application error: {}", ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error. Original exception: {}", ex.getMessage(), ex);
            return null;
        }
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "HW_ERR_500"));
    }
}
