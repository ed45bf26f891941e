package decentralabs.gmp.service.endpoint;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.web3j.crypto.Hash;

import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.service.chain.ChainTransaction;
import decentralabs.gmp.service.chain.ChainTransactionManager;
import decentralabs.gmp.util.Bytes32;

/**
 * Exactly-once record of inbound messages on one chain.
 *
 * <p>Keys are {@code keccak256(intent_id || type)} rather than a transport nonce, so
 * the record stays valid when a handler is redeployed or the relay restarts from an
 * older cursor. A key never leaves the set once its transaction has committed.
 */
public class DeliveryLedger {

    private final ChainTransactionManager transactions;
    private final Set<Bytes32> delivered = ConcurrentHashMap.newKeySet();

    public DeliveryLedger(ChainTransactionManager transactions) {
        this.transactions = transactions;
    }

    public static Bytes32 deliveryKey(Bytes32 intentId, MessageType type) {
        byte[] input = new byte[Bytes32.LENGTH + 1];
        intentId.writeTo(input, 0);
        input[Bytes32.LENGTH] = type.getTag();
        return Bytes32.wrap(Hash.sha3(input));
    }

    public boolean isDelivered(Bytes32 key) {
        return delivered.contains(key);
    }

    public boolean isDelivered(Bytes32 intentId, MessageType type) {
        return isDelivered(deliveryKey(intentId, type));
    }

    /**
     * Marks the key inside the running transaction.
     *
     * @return false if the key was already marked
     */
    public boolean markDelivered(Bytes32 key) {
        ChainTransaction tx = transactions.current();
        if (!delivered.add(key)) {
            return false;
        }
        tx.onRollback(() -> delivered.remove(key));
        return true;
    }

    public int size() {
        return delivered.size();
    }
}
