package ph.hardwareerp.common.dto.billing;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reviewer identity for a confirm or reject action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewPaymentRequest {

    @NotBlank(message = "Reviewer is required")
    private String reviewer;
}
