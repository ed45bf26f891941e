package decentralabs.gmp.service.hub;

import decentralabs.gmp.util.Bytes32;

/**
 * Hub-side view of an intent. Transitions produce a new record.
 */
public record HubIntentRecord(
    Bytes32 intentId,
    IntentDirection direction,
    Bytes32 requester,
    HubIntentRequest request,
    HubIntentStatus status,
    long amountEscrowed,
    Bytes32 fulfilledBy
) {

    HubIntentRecord withStatus(HubIntentStatus newStatus) {
        return new HubIntentRecord(intentId, direction, requester, request, newStatus, amountEscrowed, fulfilledBy);
    }

    HubIntentRecord escrowConfirmed(long amount) {
        return new HubIntentRecord(intentId, direction, requester, request, HubIntentStatus.ESCROW_CONFIRMED, amount, fulfilledBy);
    }

    HubIntentRecord fulfilled(Bytes32 solver) {
        return new HubIntentRecord(intentId, direction, requester, request, HubIntentStatus.FULFILLED, amountEscrowed, solver);
    }
}
