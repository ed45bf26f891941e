package decentralabs.gmp.service.relay;

import java.util.List;

import decentralabs.gmp.service.chain.ChainContext;
import decentralabs.gmp.service.endpoint.DeliveryReceipt;
import decentralabs.gmp.service.endpoint.OutboundMessage;
import decentralabs.gmp.util.Bytes32;

/**
 * Talks to a chain hosted in this process.
 */
public class LocalChainClient implements MailboxSource, DeliveryTarget {

    private final ChainContext chain;

    public LocalChainClient(ChainContext chain) {
        this.chain = chain;
    }

    @Override
    public long chainId() {
        return chain.getChainId();
    }

    @Override
    public List<OutboundMessage> fetchOutbound(long afterNonce, int limit) {
        return chain.getMailbox().entriesAfter(afterNonce, limit);
    }

    @Override
    public DeliveryReceipt deliver(Bytes32 relay, long srcChainId, Bytes32 srcAddr, byte[] payload) {
        return chain.getEndpoint().deliver(relay, srcChainId, srcAddr, payload);
    }
}
