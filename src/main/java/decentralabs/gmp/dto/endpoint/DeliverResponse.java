package decentralabs.gmp.dto.endpoint;

import decentralabs.gmp.service.endpoint.DeliveryReceipt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliverResponse {
    private boolean success;
    private long chainId;
    private long srcChainId;
    private String intentId;
    private String messageType;
    private String deliveryKey;
    private int handlerCount;

    public static DeliverResponse from(DeliveryReceipt receipt) {
        return DeliverResponse.builder()
            .success(true)
            .chainId(receipt.chainId())
            .srcChainId(receipt.srcChainId())
            .intentId(receipt.intentId().toHex())
            .messageType(receipt.type().getWireValue())
            .deliveryKey(receipt.deliveryKey().toHex())
            .handlerCount(receipt.handlerCount())
            .build();
    }
}
