package decentralabs.gmp.dto.message;

import decentralabs.gmp.util.Bytes32;

/**
 * Hub to connected chain. Sent on intent creation to tell the connected chain
 * what must be provided, by whom and until when.
 *
 * @param solverAddr {@link Bytes32#ZERO} when any solver may fulfill
 * @param expiry     unix seconds, unsigned
 */
public record IntentRequirements(
    Bytes32 intentId,
    Bytes32 requesterAddr,
    long amountRequired,
    Bytes32 tokenAddr,
    Bytes32 solverAddr,
    long expiry
) implements GmpMessage {

    @Override
    public MessageType type() {
        return MessageType.INTENT_REQUIREMENTS;
    }
}
