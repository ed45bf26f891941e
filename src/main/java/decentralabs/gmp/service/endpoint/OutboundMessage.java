package decentralabs.gmp.service.endpoint;

import java.time.Instant;

import decentralabs.gmp.util.Bytes32;

/**
 * Immutable outbound mailbox entry. The payload array is never exposed for mutation.
 */
public record OutboundMessage(
    long nonce,
    long srcChainId,
    Bytes32 srcAddr,
    long dstChainId,
    Bytes32 dstAddr,
    byte[] payload,
    Instant createdAt
) {

    public OutboundMessage {
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
