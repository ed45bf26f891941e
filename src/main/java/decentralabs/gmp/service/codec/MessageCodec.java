package decentralabs.gmp.service.codec;

import java.nio.ByteBuffer;

import decentralabs.gmp.dto.message.EscrowConfirmation;
import decentralabs.gmp.dto.message.FulfillmentProof;
import decentralabs.gmp.dto.message.GmpMessage;
import decentralabs.gmp.dto.message.IntentRequirements;
import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.util.Bytes32;

/**
 * Fixed-width GMP wire format: byte 0 is the discriminator, integers are big-endian
 * u64 and addresses are 32 bytes. No serialization library, so the same bytes are
 * produced and read by every chain implementation.
 *
 * <pre>
 * IntentRequirements  145B  intent_id(32) requester(32) amount_required(8) token(32) solver(32) expiry(8)
 * EscrowConfirmation  137B  intent_id(32) escrow_id(32) amount_escrowed(8) token(32) creator(32)
 * FulfillmentProof     81B  intent_id(32) solver(32) amount_fulfilled(8) timestamp(8)
 * </pre>
 */
public final class MessageCodec {

    /** Tag plus intent id, shared by every variant. */
    public static final int PREFIX_SIZE = 1 + Bytes32.LENGTH;

    private MessageCodec() {
    }

    public static byte[] encode(GmpMessage message) {
        if (message instanceof IntentRequirements) {
            return encodeRequirements((IntentRequirements) message);
        }
        if (message instanceof EscrowConfirmation) {
            return encodeConfirmation((EscrowConfirmation) message);
        }
        if (message instanceof FulfillmentProof) {
            return encodeProof((FulfillmentProof) message);
        }
        throw new IllegalArgumentException("Unsupported message: " + message);
    }

    public static GmpMessage decode(byte[] payload) {
        MessageType type = peekType(payload);
        requireLength(type, payload);
        switch (type) {
            case INTENT_REQUIREMENTS:
                return readRequirements(payload);
            case ESCROW_CONFIRMATION:
                return readConfirmation(payload);
            case FULFILLMENT_PROOF:
                return readProof(payload);
            default:
                throw new GmpException(GmpErrorCode.UNKNOWN_MESSAGE_TYPE, "Unknown message type " + type);
        }
    }

    /**
     * Reads and validates only the discriminator byte.
     */
    public static MessageType peekType(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new GmpException(GmpErrorCode.EMPTY_PAYLOAD, "Payload is empty");
        }
        return MessageType.fromTag(payload[0])
            .orElseThrow(() -> new GmpException(GmpErrorCode.UNKNOWN_MESSAGE_TYPE,
                String.format("Unknown message type: 0x%02x", payload[0] & 0xff)));
    }

    /**
     * Reads the intent id from the shared prefix without a full decode.
     */
    public static Bytes32 peekIntentId(byte[] payload) {
        if (payload == null || payload.length < PREFIX_SIZE) {
            throw new GmpException(GmpErrorCode.INVALID_PAYLOAD,
                "Payload shorter than " + PREFIX_SIZE + " bytes");
        }
        return Bytes32.read(payload, 1);
    }

    public static IntentRequirements decodeRequirements(byte[] payload) {
        requireVariant(MessageType.INTENT_REQUIREMENTS, payload);
        return readRequirements(payload);
    }

    public static EscrowConfirmation decodeConfirmation(byte[] payload) {
        requireVariant(MessageType.ESCROW_CONFIRMATION, payload);
        return readConfirmation(payload);
    }

    public static FulfillmentProof decodeProof(byte[] payload) {
        requireVariant(MessageType.FULFILLMENT_PROOF, payload);
        return readProof(payload);
    }

    private static byte[] encodeRequirements(IntentRequirements m) {
        ByteBuffer buf = ByteBuffer.allocate(MessageType.INTENT_REQUIREMENTS.getSize());
        buf.put(MessageType.INTENT_REQUIREMENTS.getTag());
        buf.put(m.intentId().toArray());
        buf.put(m.requesterAddr().toArray());
        buf.putLong(m.amountRequired());
        buf.put(m.tokenAddr().toArray());
        buf.put(m.solverAddr().toArray());
        buf.putLong(m.expiry());
        return buf.array();
    }

    private static byte[] encodeConfirmation(EscrowConfirmation m) {
        ByteBuffer buf = ByteBuffer.allocate(MessageType.ESCROW_CONFIRMATION.getSize());
        buf.put(MessageType.ESCROW_CONFIRMATION.getTag());
        buf.put(m.intentId().toArray());
        buf.put(m.escrowId().toArray());
        buf.putLong(m.amountEscrowed());
        buf.put(m.tokenAddr().toArray());
        buf.put(m.creatorAddr().toArray());
        return buf.array();
    }

    private static byte[] encodeProof(FulfillmentProof m) {
        ByteBuffer buf = ByteBuffer.allocate(MessageType.FULFILLMENT_PROOF.getSize());
        buf.put(MessageType.FULFILLMENT_PROOF.getTag());
        buf.put(m.intentId().toArray());
        buf.put(m.solverAddr().toArray());
        buf.putLong(m.amountFulfilled());
        buf.putLong(m.timestamp());
        return buf.array();
    }

    private static IntentRequirements readRequirements(byte[] p) {
        ByteBuffer buf = ByteBuffer.wrap(p);
        return new IntentRequirements(
            Bytes32.read(p, 1),
            Bytes32.read(p, 33),
            buf.getLong(65),
            Bytes32.read(p, 73),
            Bytes32.read(p, 105),
            buf.getLong(137)
        );
    }

    private static EscrowConfirmation readConfirmation(byte[] p) {
        ByteBuffer buf = ByteBuffer.wrap(p);
        return new EscrowConfirmation(
            Bytes32.read(p, 1),
            Bytes32.read(p, 33),
            buf.getLong(65),
            Bytes32.read(p, 73),
            Bytes32.read(p, 105)
        );
    }

    private static FulfillmentProof readProof(byte[] p) {
        ByteBuffer buf = ByteBuffer.wrap(p);
        return new FulfillmentProof(
            Bytes32.read(p, 1),
            Bytes32.read(p, 33),
            buf.getLong(65),
            buf.getLong(73)
        );
    }

    private static void requireVariant(MessageType expected, byte[] payload) {
        requireLength(expected, payload);
        if (payload[0] != expected.getTag()) {
            throw new GmpException(GmpErrorCode.INVALID_MESSAGE_TYPE,
                String.format("Invalid message type: expected 0x%02x, got 0x%02x",
                    expected.getTag(), payload[0] & 0xff));
        }
    }

    private static void requireLength(MessageType type, byte[] payload) {
        int got = payload == null ? 0 : payload.length;
        if (got != type.getSize()) {
            throw new GmpException(GmpErrorCode.INVALID_LENGTH,
                "Invalid message length: expected " + type.getSize() + " bytes, got " + got);
        }
    }
}
