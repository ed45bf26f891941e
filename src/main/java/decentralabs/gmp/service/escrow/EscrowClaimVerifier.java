package decentralabs.gmp.service.escrow;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Locale;

import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies approver signatures for the signature-based escrow release. The approver
 * signs the 32 intent id bytes with a personal-sign (EIP-191) secp256k1 signature.
 */
@Slf4j
public class EscrowClaimVerifier {

    private final String approverAddress;

    public EscrowClaimVerifier(String approverAddress) {
        this.approverAddress = approverAddress == null ? "" : approverAddress.toLowerCase(Locale.ROOT);
    }

    public boolean isConfigured() {
        return !approverAddress.isBlank();
    }

    public boolean verify(Bytes32 intentId, String signatureHex) {
        if (!isConfigured() || signatureHex == null || signatureHex.isBlank()) {
            return false;
        }
        try {
            Sign.SignatureData sigData = signatureToData(signatureHex);
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(intentId.toArray(), sigData);
            String recovered = "0x" + Keys.getAddress(publicKey);
            return recovered.equalsIgnoreCase(approverAddress);
        } catch (SignatureException | IllegalArgumentException ex) {
            log.warn("Rejected claim signature for intent {}: {}", LogSanitizer.shortHex(intentId), LogSanitizer.sanitize(ex.getMessage()));
            return false;
        }
    }

    private Sign.SignatureData signatureToData(String signatureHex) {
        byte[] signatureBytes = Numeric.hexStringToByteArray(signatureHex);
        if (signatureBytes.length != 65) {
            throw new IllegalArgumentException("Invalid signature length: " + signatureBytes.length);
        }
        byte v = signatureBytes[64];
        // v is expected to be 27 or 28
        if (v < 27) {
            v = (byte) (v + 27);
        }
        byte[] r = new byte[32];
        byte[] s = new byte[32];
        System.arraycopy(signatureBytes, 0, r, 0, 32);
        System.arraycopy(signatureBytes, 32, s, 0, 32);
        return new Sign.SignatureData(v, r, s);
    }
}
