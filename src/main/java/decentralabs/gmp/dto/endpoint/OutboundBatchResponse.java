package decentralabs.gmp.dto.endpoint;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundBatchResponse {
    private boolean success;
    private long chainId;
    private long latestNonce;
    @Builder.Default
    private List<OutboundMessageResponse> messages = new ArrayList<>();
}
