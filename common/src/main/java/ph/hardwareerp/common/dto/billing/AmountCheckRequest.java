package ph.hardwareerp.common.dto.billing;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmountCheckRequest {

    @NotNull(message = "Amount is required")
    private BigDecimal amount;
}
