package decentralabs.gmp.service.outflow;

import decentralabs.gmp.util.Bytes32;

/**
 * Requirements delivered from the hub for value leaving it. {@code fulfilled} flips
 * to true once and never back.
 *
 * @param srcChainId chain the requirements came from; the proof goes back there
 * @param srcAddr    hub handler that sent them
 */
public record OutflowRequirements(
    Bytes32 intentId,
    Bytes32 requesterAddr,
    long amountRequired,
    Bytes32 tokenAddr,
    Bytes32 solverAddr,
    long expiry,
    long srcChainId,
    Bytes32 srcAddr,
    boolean fulfilled,
    Bytes32 fulfilledBy
) {

    OutflowRequirements fulfilledBy(Bytes32 solver) {
        return new OutflowRequirements(intentId, requesterAddr, amountRequired, tokenAddr, solverAddr, expiry,
            srcChainId, srcAddr, true, solver);
    }

    public boolean isSolverPinned() {
        return !solverAddr.isZero();
    }
}
