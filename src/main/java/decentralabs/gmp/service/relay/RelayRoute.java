package decentralabs.gmp.service.relay;

/**
 * Directed (source chain, destination chain) pair served by one worker.
 */
public record RelayRoute(long srcChainId, long dstChainId) {

    public String name() {
        return srcChainId + "->" + dstChainId;
    }
}
