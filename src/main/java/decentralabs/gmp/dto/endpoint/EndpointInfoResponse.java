package decentralabs.gmp.dto.endpoint;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class EndpointInfoResponse {
    private long chainId;
    private String admin;
    private List<String> relays;
    private Map<Long, List<String>> remotes;
    private Map<String, List<String>> handlers;
    private List<String> ignoredTypes;
    private long latestNonce;
    private int deliveredCount;
}
