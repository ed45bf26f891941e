package decentralabs.gmp.service.relay;

import java.util.List;

import decentralabs.gmp.service.endpoint.OutboundMessage;

/**
 * Read side of a chain's outbound mailbox.
 */
public interface MailboxSource {

    long chainId();

    /**
     * Committed entries with nonce greater than {@code afterNonce}, in nonce order.
     */
    List<OutboundMessage> fetchOutbound(long afterNonce, int limit);
}
