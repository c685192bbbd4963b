package ph.hardwareerp.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all Hardware ERP business exceptions.
 */
@Getter
public class HardwareErpException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public HardwareErpException(String message) {
        super(message);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "HW_ERR_001";
    }

    public HardwareErpException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HardwareErpException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "HW_ERR_001";
    }
}
