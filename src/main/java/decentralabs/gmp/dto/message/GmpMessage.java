package decentralabs.gmp.dto.message;

import decentralabs.gmp.util.Bytes32;

/**
 * One of the three cross-chain messages. Every variant starts with the tag byte
 * followed by the intent id.
 */
public interface GmpMessage {

    MessageType type();

    Bytes32 intentId();
}
