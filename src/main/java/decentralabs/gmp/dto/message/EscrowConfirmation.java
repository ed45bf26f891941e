package decentralabs.gmp.dto.message;

import decentralabs.gmp.util.Bytes32;

/**
 * Connected chain to hub. Confirms an escrow matching the intent requirements
 * was funded; the hub gates solver fulfillment on it.
 */
public record EscrowConfirmation(
    Bytes32 intentId,
    Bytes32 escrowId,
    long amountEscrowed,
    Bytes32 tokenAddr,
    Bytes32 creatorAddr
) implements GmpMessage {

    @Override
    public MessageType type() {
        return MessageType.ESCROW_CONFIRMATION;
    }
}
