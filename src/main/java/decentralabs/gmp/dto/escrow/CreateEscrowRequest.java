package decentralabs.gmp.dto.escrow;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateEscrowRequest {

    @NotBlank
    private String intentId;

    @NotBlank
    private String token;

    // u64 as a decimal string
    @NotBlank
    @Pattern(regexp = "^[0-9]+$", message = "must be a decimal integer")
    private String amount;

    /** Solver the escrow is reserved for; may be omitted when the hub requirements pin one. */
    private String solver;

    /** Seconds until the requester may cancel; omitted uses the chain default. */
    private Long expirySeconds;
}
