package decentralabs.gmp.service.chain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Unit of work on one chain. Every mutation registers how to undo itself; effects
 * that must not be observed before the unit commits (mailbox visibility, log lines)
 * are deferred to commit.
 */
public class ChainTransaction {

    private final Deque<Runnable> rollbackActions = new ArrayDeque<>();
    private final List<Runnable> commitActions = new ArrayList<>();

    public void onRollback(Runnable action) {
        rollbackActions.push(action);
    }

    public void afterCommit(Runnable action) {
        commitActions.add(action);
    }

    /**
     * Puts {@code value} into {@code map}, restoring the previous mapping on rollback.
     */
    public <K, V> void put(Map<K, V> map, K key, V value) {
        V previous = map.put(key, value);
        onRollback(() -> {
            if (previous == null) {
                map.remove(key);
            } else {
                map.put(key, previous);
            }
        });
    }

    void commit() {
        rollbackActions.clear();
        commitActions.forEach(Runnable::run);
        commitActions.clear();
    }

    void rollback() {
        while (!rollbackActions.isEmpty()) {
            rollbackActions.pop().run();
        }
        commitActions.clear();
    }
}
