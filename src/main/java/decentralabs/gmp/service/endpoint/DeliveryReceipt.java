package decentralabs.gmp.service.endpoint;

import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.util.Bytes32;

/**
 * Outcome of an accepted delivery.
 *
 * @param handlerCount handlers invoked; zero when the chain ignores the message type
 */
public record DeliveryReceipt(
    long chainId,
    long srcChainId,
    Bytes32 intentId,
    MessageType type,
    Bytes32 deliveryKey,
    int handlerCount
) {
}
