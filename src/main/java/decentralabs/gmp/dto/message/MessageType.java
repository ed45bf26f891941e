package decentralabs.gmp.dto.message;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * GMP message discriminators with their fixed encoded sizes (tag byte included).
 */
public enum MessageType {
    INTENT_REQUIREMENTS((byte) 0x01, 145, "intent_requirements"),
    ESCROW_CONFIRMATION((byte) 0x02, 137, "escrow_confirmation"),
    FULFILLMENT_PROOF((byte) 0x03, 81, "fulfillment_proof");

    private final byte tag;
    private final int size;
    private final String wireValue;

    MessageType(byte tag, int size, String wireValue) {
        this.tag = tag;
        this.size = size;
        this.wireValue = wireValue;
    }

    public byte getTag() {
        return tag;
    }

    public int getSize() {
        return size;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public static Optional<MessageType> fromTag(byte tag) {
        for (MessageType type : values()) {
            if (type.tag == tag) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
