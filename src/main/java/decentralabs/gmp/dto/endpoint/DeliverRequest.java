package decentralabs.gmp.dto.endpoint;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message handed to a destination endpoint by a relay.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliverRequest {

    @NotNull
    private Long srcChainId;

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{1,64}$", message = "must be a 0x-prefixed address of at most 32 bytes")
    private String srcAddr;

    @NotBlank
    @Pattern(regexp = "^0x([0-9a-fA-F]{2})+$", message = "must be 0x-prefixed hex bytes")
    private String payload;
}
