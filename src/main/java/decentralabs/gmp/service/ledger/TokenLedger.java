package decentralabs.gmp.service.ledger;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.chain.ChainTransaction;
import decentralabs.gmp.service.chain.ChainTransactionManager;
import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.LogSanitizer;
import decentralabs.gmp.util.Uint64;

/**
 * Token balances held on one chain, keyed by (token, account). Escrow custody is an
 * ordinary account owned by the escrow handler's address.
 */
public class TokenLedger {

    private final ChainTransactionManager transactions;
    private final Map<Holding, BigInteger> balances = new ConcurrentHashMap<>();

    public TokenLedger(ChainTransactionManager transactions) {
        this.transactions = transactions;
    }

    public BigInteger balanceOf(Bytes32 token, Bytes32 account) {
        return balances.getOrDefault(new Holding(token, account), BigInteger.ZERO);
    }

    /**
     * Credits newly issued tokens, used for seeding balances.
     */
    public void mint(Bytes32 token, Bytes32 account, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Mint amount cannot be negative");
        }
        ChainTransaction tx = transactions.current();
        Holding holding = new Holding(token, account);
        tx.put(balances, holding, balanceOf(token, account).add(amount));
    }

    /**
     * Moves {@code amount} (u64) of {@code token} between two accounts.
     */
    public void transfer(Bytes32 token, Bytes32 from, Bytes32 to, long amount) {
        BigInteger value = Uint64.toBigInteger(amount);
        ChainTransaction tx = transactions.current();
        BigInteger fromBalance = balanceOf(token, from);
        if (fromBalance.compareTo(value) < 0) {
            throw new GmpException(GmpErrorCode.INSUFFICIENT_BALANCE,
                "Account " + LogSanitizer.shortHex(from) + " holds " + fromBalance + " of token "
                    + LogSanitizer.shortHex(token) + ", needs " + value);
        }
        if (from.equals(to)) {
            return;
        }
        tx.put(balances, new Holding(token, from), fromBalance.subtract(value));
        tx.put(balances, new Holding(token, to), balanceOf(token, to).add(value));
    }

    private record Holding(Bytes32 token, Bytes32 account) { }
}
