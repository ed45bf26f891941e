package decentralabs.gmp.service.chain;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;

/**
 * Chains hosted by this process, by chain id.
 */
public class ChainRegistry {

    private final Map<Long, ChainContext> chains = new TreeMap<>();

    public ChainRegistry(List<ChainContext> contexts) {
        for (ChainContext chain : contexts) {
            if (chains.putIfAbsent(chain.getChainId(), chain) != null) {
                throw new IllegalStateException("Chain " + chain.getChainId() + " configured twice");
            }
        }
    }

    public Optional<ChainContext> find(long chainId) {
        return Optional.ofNullable(chains.get(chainId));
    }

    public ChainContext require(long chainId) {
        return find(chainId).orElseThrow(() ->
            new GmpException(GmpErrorCode.UNKNOWN_CHAIN, "Chain " + chainId + " is not hosted here"));
    }

    public Collection<ChainContext> all() {
        return Collections.unmodifiableCollection(chains.values());
    }
}
