package ph.hardwareerp.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a backend store (Firestore) call fails or times out.
 * The outcome of the call is unknown; callers must re-fetch before retrying.
 */
public class ExternalServiceException extends HardwareErpException {

    private final String serviceName;

    public ExternalServiceException(String serviceName, String message) {
        super(
            String.format("External service '%s' error: %s", serviceName, message),
            HttpStatus.BAD_GATEWAY,
            "HW_ERR_502"
        );
        this.serviceName = serviceName;
    }

    public ExternalServiceException(String serviceName, String message, Throwable cause) {
        super(
            String.format("External service '%s' error: %s", serviceName, message),
            HttpStatus.BAD_GATEWAY,
            "HW_ERR_502"
        );
        this.serviceName = serviceName;
        if (cause != null) {
            initCause(cause);
        }
    }

    public String getServiceName() {
        return serviceName;
    }
}
