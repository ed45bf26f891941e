package decentralabs.gmp.service.endpoint;

import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.util.Bytes32;

/**
 * Authenticated inbound message as passed to a handler.
 */
public record InboundMessage(
    long srcChainId,
    Bytes32 srcAddr,
    MessageType type,
    Bytes32 intentId,
    byte[] payload
) {
}
