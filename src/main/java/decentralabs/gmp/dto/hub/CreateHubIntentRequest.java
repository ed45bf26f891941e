package decentralabs.gmp.dto.hub;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateHubIntentRequest {

    @NotBlank
    private String intentId;

    @NotNull
    private Long connectedChainId;

    /** Handler on the connected chain receiving the requirements. */
    @NotBlank
    private String connectedHandler;

    /** Requester's address on the connected chain; defaults to the caller. */
    private String connectedRequester;

    @NotBlank
    private String hubToken;

    @NotBlank
    @Pattern(regexp = "^[0-9]+$", message = "must be a decimal integer")
    private String hubAmount;

    @NotBlank
    private String connectedToken;

    @NotBlank
    @Pattern(regexp = "^[0-9]+$", message = "must be a decimal integer")
    private String connectedAmount;

    private String solver;

    /** Unix seconds. */
    @NotNull
    private Long expiry;
}
