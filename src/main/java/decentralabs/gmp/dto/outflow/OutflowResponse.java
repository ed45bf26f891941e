package decentralabs.gmp.dto.outflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import decentralabs.gmp.service.outflow.OutflowRequirements;
import decentralabs.gmp.util.Uint64;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutflowResponse {
    private boolean success;
    private long chainId;
    private String intentId;
    private String requester;
    private String amountRequired;
    private String token;
    private String solver;
    private long expiry;
    private long hubChainId;
    private boolean fulfilled;
    private String fulfilledBy;
    /** Mailbox nonce of the fulfillment proof, set on fulfill responses. */
    private Long proofNonce;

    public static OutflowResponse from(long chainId, OutflowRequirements req, Long proofNonce) {
        return OutflowResponse.builder()
            .success(true)
            .chainId(chainId)
            .intentId(req.intentId().toHex())
            .requester(req.requesterAddr().toHex())
            .amountRequired(Uint64.toString(req.amountRequired()))
            .token(req.tokenAddr().toHex())
            .solver(req.solverAddr().toHex())
            .expiry(req.expiry())
            .hubChainId(req.srcChainId())
            .fulfilled(req.fulfilled())
            .fulfilledBy(req.fulfilledBy() != null ? req.fulfilledBy().toHex() : null)
            .proofNonce(proofNonce)
            .build();
    }
}
