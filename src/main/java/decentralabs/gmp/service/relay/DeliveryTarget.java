package decentralabs.gmp.service.relay;

import decentralabs.gmp.service.endpoint.DeliveryReceipt;
import decentralabs.gmp.util.Bytes32;

/**
 * Write side of a destination chain's endpoint. Rejections surface as
 * {@link decentralabs.gmp.exception.GmpException}; transport problems as
 * {@link RelayTransportException}.
 */
public interface DeliveryTarget {

    long chainId();

    DeliveryReceipt deliver(Bytes32 relay, long srcChainId, Bytes32 srcAddr, byte[] payload);
}
