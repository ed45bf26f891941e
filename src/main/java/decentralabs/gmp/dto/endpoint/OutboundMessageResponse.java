package decentralabs.gmp.dto.endpoint;

import java.time.Instant;

import org.web3j.utils.Numeric;

import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.service.endpoint.OutboundMessage;
import decentralabs.gmp.util.Bytes32;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON view of a mailbox entry. The payload travels as 0x-prefixed hex.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessageResponse {
    private long nonce;
    private long srcChainId;
    private String srcAddr;
    private long dstChainId;
    private String dstAddr;
    private String messageType;
    private String payload;
    private String createdAt;

    public static OutboundMessageResponse from(OutboundMessage message) {
        byte[] payload = message.payload();
        return OutboundMessageResponse.builder()
            .nonce(message.nonce())
            .srcChainId(message.srcChainId())
            .srcAddr(message.srcAddr().toHex())
            .dstChainId(message.dstChainId())
            .dstAddr(message.dstAddr().toHex())
            .messageType(payload.length > 0
                ? MessageType.fromTag(payload[0]).map(MessageType::getWireValue).orElse(null)
                : null)
            .payload(Numeric.toHexString(payload))
            .createdAt(message.createdAt().toString())
            .build();
    }

    public OutboundMessage toMessage() {
        return new OutboundMessage(
            nonce,
            srcChainId,
            Bytes32.fromHex(srcAddr),
            dstChainId,
            Bytes32.fromHex(dstAddr),
            Numeric.hexStringToByteArray(payload),
            createdAt != null ? Instant.parse(createdAt) : Instant.EPOCH
        );
    }
}
