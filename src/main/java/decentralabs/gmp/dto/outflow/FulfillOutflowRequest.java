package decentralabs.gmp.dto.outflow;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FulfillOutflowRequest {

    /** Token the solver pays with; must match the requirements. */
    @NotBlank
    private String token;
}
