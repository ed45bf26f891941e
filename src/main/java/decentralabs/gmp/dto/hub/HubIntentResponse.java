package decentralabs.gmp.dto.hub;

import com.fasterxml.jackson.annotation.JsonInclude;

import decentralabs.gmp.service.hub.HubIntentRecord;
import decentralabs.gmp.service.hub.HubIntentRequest;
import decentralabs.gmp.util.Uint64;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HubIntentResponse {
    private boolean success;
    private long chainId;
    private String intentId;
    private String direction;
    private String status;
    private String requester;
    private long connectedChainId;
    private String connectedHandler;
    private String hubToken;
    private String hubAmount;
    private String connectedToken;
    private String connectedAmount;
    private String amountEscrowed;
    private String solver;
    private long expiry;
    private String fulfilledBy;

    public static HubIntentResponse from(long chainId, HubIntentRecord record) {
        HubIntentRequest request = record.request();
        return HubIntentResponse.builder()
            .success(true)
            .chainId(chainId)
            .intentId(record.intentId().toHex())
            .direction(record.direction().getWireValue())
            .status(record.status().getWireValue())
            .requester(record.requester().toHex())
            .connectedChainId(request.connectedChainId())
            .connectedHandler(request.connectedHandler().toHex())
            .hubToken(request.hubToken().toHex())
            .hubAmount(Uint64.toString(request.hubAmount()))
            .connectedToken(request.connectedToken().toHex())
            .connectedAmount(Uint64.toString(request.connectedAmount()))
            .amountEscrowed(Uint64.toString(record.amountEscrowed()))
            .solver(request.solver().toHex())
            .expiry(request.expiry())
            .fulfilledBy(record.fulfilledBy().isZero() ? null : record.fulfilledBy().toHex())
            .build();
    }
}
