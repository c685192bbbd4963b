package ph.hardwareerp.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when validation fails. Always raised before any write.
 */
public class ValidationException extends HardwareErpException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "HW_ERR_400");
    }

    public ValidationException(String field, String message) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "HW_ERR_400"
        );
    }
}
