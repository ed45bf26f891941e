package decentralabs.gmp.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("Bytes32 Tests")
class Bytes32Test {

    private static final String EVM_ADDRESS = "0x1234567890abcdef1234567890abcdef12345678";

    @Nested
    @DisplayName("Native Address Tests")
    class NativeAddressTests {

        @Test
        @DisplayName("Should left-pad a 20-byte address")
        void shouldLeftPadEvmAddress() {
            Bytes32 value = Bytes32.fromHex(EVM_ADDRESS);

            assertThat(value.toHex()).isEqualTo("0x000000000000000000000000" + EVM_ADDRESS.substring(2));
            assertThat(value.toArray()).hasSize(32);
        }

        @Test
        @DisplayName("Should recover the native address from the low-order bytes")
        void shouldRecoverNativeAddress() {
            Bytes32 value = Bytes32.fromHex(EVM_ADDRESS);

            byte[] nativeAddress = value.toNative(20);

            assertThat(Bytes32.fromNative(nativeAddress)).isEqualTo(value);
            assertThat(nativeAddress[0]).isEqualTo((byte) 0x12);
        }

        @Test
        @DisplayName("Should reject narrowing when high-order bytes are set")
        void shouldRejectLossyNarrowing() {
            Bytes32 full = Bytes32.fromHex("0x01" + "00".repeat(31));

            assertThatThrownBy(() -> full.toNative(20))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should restore stripped leading zeros")
        void shouldRestoreOddLengthHex() {
            assertThat(Bytes32.fromHex("0xabc")).isEqualTo(Bytes32.fromHex("0x0abc"));
        }
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Should reject values longer than 32 bytes")
        void shouldRejectTooLong() {
            assertThatThrownBy(() -> Bytes32.fromHex("0x" + "11".repeat(33)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("longer than 32 bytes");
        }

        @Test
        @DisplayName("Should reject non-hex characters")
        void shouldRejectNonHex() {
            assertThatThrownBy(() -> Bytes32.fromHex("0xzz"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject blank input")
        void shouldRejectBlank() {
            assertThatThrownBy(() -> Bytes32.fromHex(" "))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject wrapping anything but 32 bytes")
        void shouldRejectWrongWrapLength() {
            assertThatThrownBy(() -> Bytes32.wrap(new byte[31]))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Should not expose its backing array")
    void shouldBeImmutable() {
        byte[] raw = new byte[32];
        Bytes32 value = Bytes32.wrap(raw);
        raw[0] = 1;
        value.toArray()[1] = 1;

        assertThat(value.isZero()).isTrue();
        assertThat(value).isEqualTo(Bytes32.ZERO);
    }

    @Test
    @DisplayName("Should serialize to and from JSON as hex")
    void shouldSerializeAsHex() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Bytes32 value = Bytes32.fromHex(EVM_ADDRESS);

        String json = mapper.writeValueAsString(value);

        assertThat(json).isEqualTo("\"" + value.toHex() + "\"");
        assertThat(mapper.readValue(json, Bytes32.class)).isEqualTo(value);
    }
}
