package decentralabs.gmp.service.endpoint;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import decentralabs.gmp.service.chain.ChainTransaction;
import decentralabs.gmp.service.chain.ChainTransactionManager;
import decentralabs.gmp.util.Bytes32;

/**
 * Append-only log of messages sent from one chain. Nonces start at 1 and grow by
 * one per appended message; an entry becomes readable once its transaction commits.
 */
public class OutboundMailbox {

    private final long chainId;
    private final Clock clock;
    private final ChainTransactionManager transactions;
    private final NavigableMap<Long, OutboundMessage> entries = new ConcurrentSkipListMap<>();
    private long nextNonce = 1;

    public OutboundMailbox(long chainId, Clock clock, ChainTransactionManager transactions) {
        this.chainId = chainId;
        this.clock = clock;
        this.transactions = transactions;
    }

    long append(Bytes32 srcAddr, long dstChainId, Bytes32 dstAddr, byte[] payload) {
        ChainTransaction tx = transactions.current();
        long nonce = nextNonce++;
        tx.onRollback(() -> nextNonce = nonce);
        OutboundMessage message = new OutboundMessage(nonce, chainId, srcAddr, dstChainId, dstAddr, payload, clock.instant());
        tx.afterCommit(() -> entries.put(nonce, message));
        return nonce;
    }

    /**
     * Committed entries with a nonce strictly greater than {@code afterNonce}, in nonce order.
     */
    public List<OutboundMessage> entriesAfter(long afterNonce, int limit) {
        List<OutboundMessage> result = new ArrayList<>();
        for (OutboundMessage message : entries.tailMap(afterNonce, false).values()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(message);
        }
        return result;
    }

    public long latestNonce() {
        return entries.isEmpty() ? 0 : entries.lastKey();
    }

    public int size() {
        return entries.size();
    }
}
