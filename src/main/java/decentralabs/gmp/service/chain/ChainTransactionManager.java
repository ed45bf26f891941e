package decentralabs.gmp.service.chain;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

/**
 * Serializes state changes on one chain. A unit of work runs under the chain lock;
 * nested calls on the same thread join the running transaction, so a handler that
 * sends a message commits or rolls back together with the delivery that invoked it.
 */
@Slf4j
public class ChainTransactionManager {

    private final long chainId;
    private final ReentrantLock lock = new ReentrantLock();
    private final ThreadLocal<ChainTransaction> current = new ThreadLocal<>();

    public ChainTransactionManager(long chainId) {
        this.chainId = chainId;
    }

    public <T> T execute(Supplier<T> work) {
        ChainTransaction active = current.get();
        if (active != null) {
            return work.get();
        }
        lock.lock();
        ChainTransaction tx = new ChainTransaction();
        current.set(tx);
        try {
            T result = work.get();
            tx.commit();
            return result;
        } catch (RuntimeException | Error e) {
            tx.rollback();
            log.debug("Chain {} transaction rolled back: {}", chainId, e.getMessage());
            throw e;
        } finally {
            current.remove();
            lock.unlock();
        }
    }

    public void execute(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }

    /**
     * The running transaction; state changes outside of one are a programming error.
     */
    public ChainTransaction current() {
        ChainTransaction tx = current.get();
        if (tx == null) {
            throw new IllegalStateException("No active transaction on chain " + chainId);
        }
        return tx;
    }
}
