package decentralabs.gmp.dto.endpoint;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteEndpointRequest {

    @NotBlank
    private String address;

    /** Keep the already trusted senders instead of replacing them. */
    private boolean append;
}
