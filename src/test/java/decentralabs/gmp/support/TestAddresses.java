package decentralabs.gmp.support;

import decentralabs.gmp.util.Bytes32;

/**
 * Readable 32-byte addresses for tests.
 */
public final class TestAddresses {

    private TestAddresses() {
    }

    public static Bytes32 addr(long value) {
        return Bytes32.fromHex(Long.toHexString(value));
    }

    public static Bytes32 intent(int n) {
        byte[] raw = new byte[Bytes32.LENGTH];
        raw[0] = (byte) 0x1d;
        raw[31] = (byte) n;
        return Bytes32.wrap(raw);
    }
}
