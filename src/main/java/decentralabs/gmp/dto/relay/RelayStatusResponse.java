package decentralabs.gmp.dto.relay;

import java.util.List;

import decentralabs.gmp.service.relay.RelayStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RelayStatusResponse {
    private boolean running;
    private List<RelayStatus> routes;
}
