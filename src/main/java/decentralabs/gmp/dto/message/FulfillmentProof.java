package decentralabs.gmp.dto.message;

import decentralabs.gmp.util.Bytes32;

/**
 * Either direction. Asserts that a solver satisfied the intent; terminal per intent.
 */
public record FulfillmentProof(
    Bytes32 intentId,
    Bytes32 solverAddr,
    long amountFulfilled,
    long timestamp
) implements GmpMessage {

    @Override
    public MessageType type() {
        return MessageType.FULFILLMENT_PROOF;
    }
}
