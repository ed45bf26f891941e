package decentralabs.gmp.dto.endpoint;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelayChangeRequest {

    @NotBlank
    private String relay;
}
