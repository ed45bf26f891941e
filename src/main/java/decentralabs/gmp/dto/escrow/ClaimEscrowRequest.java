package decentralabs.gmp.dto.escrow;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimEscrowRequest {

    /** 65-byte personal-sign signature over the intent id, hex. */
    @NotBlank
    private String signature;
}
