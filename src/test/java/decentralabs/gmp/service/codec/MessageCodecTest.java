package decentralabs.gmp.service.codec;

import static decentralabs.gmp.support.TestAddresses.addr;
import static decentralabs.gmp.support.TestAddresses.intent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import decentralabs.gmp.dto.message.EscrowConfirmation;
import decentralabs.gmp.dto.message.FulfillmentProof;
import decentralabs.gmp.dto.message.GmpMessage;
import decentralabs.gmp.dto.message.IntentRequirements;
import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.util.Bytes32;

@DisplayName("MessageCodec Tests")
class MessageCodecTest {

    private static final IntentRequirements REQUIREMENTS = new IntentRequirements(
        intent(1), addr(0xA1), 1_000_000L, addr(0x7), Bytes32.ZERO, 1_700_000_120L);

    private static final EscrowConfirmation CONFIRMATION = new EscrowConfirmation(
        intent(2), intent(2), 500_000L, addr(0x7), addr(0xA1));

    private static final FulfillmentProof PROOF = new FulfillmentProof(
        intent(3), addr(0x50), -1L, 1_700_000_000L);

    @Nested
    @DisplayName("Encoding Tests")
    class EncodingTests {

        @Test
        @DisplayName("Should produce the fixed size for each variant")
        void shouldProduceFixedSizes() {
            assertThat(MessageCodec.encode(REQUIREMENTS)).hasSize(145);
            assertThat(MessageCodec.encode(CONFIRMATION)).hasSize(137);
            assertThat(MessageCodec.encode(PROOF)).hasSize(81);
        }

        @Test
        @DisplayName("Should lay out requirements big-endian at fixed offsets")
        void shouldLayOutRequirements() {
            byte[] bytes = MessageCodec.encode(REQUIREMENTS);

            assertThat(bytes[0]).isEqualTo((byte) 0x01);
            assertThat(Bytes32.read(bytes, 1)).isEqualTo(intent(1));
            assertThat(Bytes32.read(bytes, 33)).isEqualTo(addr(0xA1));
            // 1_000_000 = 0x0F4240
            assertThat(Arrays.copyOfRange(bytes, 65, 73)).containsExactly(0, 0, 0, 0, 0, 0x0F, 0x42, 0x40);
            assertThat(Bytes32.read(bytes, 73)).isEqualTo(addr(0x7));
            assertThat(Bytes32.read(bytes, 105)).isEqualTo(Bytes32.ZERO);
        }

        @Test
        @DisplayName("Should keep u64 values above Long.MAX_VALUE")
        void shouldKeepUnsignedAmounts() {
            FulfillmentProof decoded = MessageCodec.decodeProof(MessageCodec.encode(PROOF));

            assertThat(Long.toUnsignedString(decoded.amountFulfilled())).isEqualTo("18446744073709551615");
        }

        @Test
        @DisplayName("Should decode every variant back to the same value")
        void shouldRoundTrip() {
            for (GmpMessage message : new GmpMessage[] {REQUIREMENTS, CONFIRMATION, PROOF}) {
                assertThat(MessageCodec.decode(MessageCodec.encode(message))).isEqualTo(message);
            }
        }
    }

    @Nested
    @DisplayName("Decoding Error Tests")
    class DecodingErrorTests {

        @Test
        @DisplayName("Should reject an empty payload")
        void shouldRejectEmpty() {
            assertThatThrownBy(() -> MessageCodec.decode(new byte[0]))
                .isInstanceOf(GmpException.class)
                .extracting("code").isEqualTo(GmpErrorCode.EMPTY_PAYLOAD);
        }

        @Test
        @DisplayName("Should reject an unknown tag")
        void shouldRejectUnknownTag() {
            byte[] bytes = MessageCodec.encode(PROOF);
            bytes[0] = 0x04;

            assertThatThrownBy(() -> MessageCodec.decode(bytes))
                .isInstanceOf(GmpException.class)
                .extracting("code").isEqualTo(GmpErrorCode.UNKNOWN_MESSAGE_TYPE);
        }

        @Test
        @DisplayName("Should reject a payload one byte short or long")
        void shouldRejectWrongLength() {
            byte[] encoded = MessageCodec.encode(CONFIRMATION);

            assertThatThrownBy(() -> MessageCodec.decode(Arrays.copyOf(encoded, 136)))
                .isInstanceOf(GmpException.class)
                .extracting("code").isEqualTo(GmpErrorCode.INVALID_LENGTH);
            assertThatThrownBy(() -> MessageCodec.decode(Arrays.copyOf(encoded, 138)))
                .isInstanceOf(GmpException.class)
                .extracting("code").isEqualTo(GmpErrorCode.INVALID_LENGTH);
        }

        @Test
        @DisplayName("Should reject a typed decode of another variant")
        void shouldRejectVariantMismatch() {
            byte[] proof = MessageCodec.encode(PROOF);
            byte[] relabelled = Arrays.copyOf(proof, proof.length);
            relabelled[0] = MessageType.INTENT_REQUIREMENTS.getTag();

            assertThatThrownBy(() -> MessageCodec.decodeProof(relabelled))
                .isInstanceOf(GmpException.class)
                .extracting("code").isEqualTo(GmpErrorCode.INVALID_MESSAGE_TYPE);
        }
    }

    @Nested
    @DisplayName("Peek Tests")
    class PeekTests {

        @Test
        @DisplayName("Should read type and intent id from the shared prefix")
        void shouldPeekPrefix() {
            byte[] prefixOnly = Arrays.copyOf(MessageCodec.encode(CONFIRMATION), MessageCodec.PREFIX_SIZE);

            assertThat(MessageCodec.peekType(prefixOnly)).isEqualTo(MessageType.ESCROW_CONFIRMATION);
            assertThat(MessageCodec.peekIntentId(prefixOnly)).isEqualTo(intent(2));
        }

        @Test
        @DisplayName("Should reject a payload shorter than the prefix")
        void shouldRejectShortPrefix() {
            byte[] tooShort = Arrays.copyOf(MessageCodec.encode(CONFIRMATION), 32);

            assertThatThrownBy(() -> MessageCodec.peekIntentId(tooShort))
                .isInstanceOf(GmpException.class)
                .extracting("code").isEqualTo(GmpErrorCode.INVALID_PAYLOAD);
        }
    }
}
