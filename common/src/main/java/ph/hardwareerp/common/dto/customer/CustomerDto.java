package ph.hardwareerp.common.dto.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for customer master data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDto {

    private String id;
    private String name;
    private String code;
    private String email;

    /**
     * "cash", "credit", or null when the account never had it set.
     */
    private String paymentType;
}
