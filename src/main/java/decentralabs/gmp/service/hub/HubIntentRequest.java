package decentralabs.gmp.service.hub;

import decentralabs.gmp.util.Bytes32;

/**
 * Parameters of a hub intent.
 *
 * @param connectedChainId   chain the requirements are sent to
 * @param connectedHandler   handler address on that chain
 * @param connectedRequester requester's address on the connected chain
 * @param hubAmount          outflow: amount locked on the hub; inflow: amount the solver pays on the hub
 * @param connectedAmount    outflow: amount the solver pays on the connected chain; inflow: amount to escrow there
 * @param solver             pinned solver, {@link Bytes32#ZERO} for any
 * @param expiry             unix seconds
 */
public record HubIntentRequest(
    Bytes32 intentId,
    long connectedChainId,
    Bytes32 connectedHandler,
    Bytes32 connectedRequester,
    Bytes32 hubToken,
    long hubAmount,
    Bytes32 connectedToken,
    long connectedAmount,
    Bytes32 solver,
    long expiry
) {
}
