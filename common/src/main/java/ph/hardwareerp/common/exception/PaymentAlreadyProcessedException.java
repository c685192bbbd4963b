package ph.hardwareerp.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a conditional status write affected nothing because
 * another reviewer already moved the payment out of pending.
 *
 * Callers should re-read the payment instead of retrying the same transition.
 */
@Getter
public class PaymentAlreadyProcessedException extends HardwareErpException {

    private final String paymentId;
    private final String currentStatus;

    public PaymentAlreadyProcessedException(String paymentId, String currentStatus) {
        super(
            String.format("Payment %s was already processed (current status: %s)", paymentId, currentStatus),
            HttpStatus.CONFLICT,
            "HW_ERR_409"
        );
        this.paymentId = paymentId;
        this.currentStatus = currentStatus;
    }
}
