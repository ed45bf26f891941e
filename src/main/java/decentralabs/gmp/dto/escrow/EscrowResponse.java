package decentralabs.gmp.dto.escrow;

import com.fasterxml.jackson.annotation.JsonInclude;

import decentralabs.gmp.service.escrow.EscrowRecord;
import decentralabs.gmp.util.Uint64;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EscrowResponse {
    private boolean success;
    private long chainId;
    private String intentId;
    private String requester;
    private String token;
    private String amount;
    private String reservedSolver;
    private long expiry;
    private String state;
    private String paidTo;

    public static EscrowResponse from(long chainId, EscrowRecord record) {
        return EscrowResponse.builder()
            .success(true)
            .chainId(chainId)
            .intentId(record.intentId().toHex())
            .requester(record.requester().toHex())
            .token(record.token().toHex())
            .amount(Uint64.toString(record.amount()))
            .reservedSolver(record.reservedSolver().toHex())
            .expiry(record.expiry())
            .state(record.state().getWireValue())
            .paidTo(record.paidTo() != null ? record.paidTo().toHex() : null)
            .build();
    }
}
