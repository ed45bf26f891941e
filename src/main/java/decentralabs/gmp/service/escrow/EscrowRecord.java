package decentralabs.gmp.service.escrow;

import decentralabs.gmp.util.Bytes32;

/**
 * Escrow held on the connected chain. Transitions produce a new record; the amount
 * is zero exactly when the state is terminal.
 *
 * @param reservedSolver payee bound at creation
 * @param expiry         unix seconds
 */
public record EscrowRecord(
    Bytes32 intentId,
    Bytes32 requester,
    Bytes32 token,
    long amount,
    Bytes32 reservedSolver,
    long expiry,
    EscrowState state,
    Bytes32 paidTo
) {

    static EscrowRecord open(Bytes32 intentId, Bytes32 requester, Bytes32 token, long amount, Bytes32 reservedSolver, long expiry) {
        return new EscrowRecord(intentId, requester, token, amount, reservedSolver, expiry, EscrowState.OPEN, null);
    }

    EscrowRecord released(Bytes32 payee) {
        return new EscrowRecord(intentId, requester, token, 0, reservedSolver, expiry, EscrowState.RELEASED, payee);
    }

    EscrowRecord cancelled() {
        return new EscrowRecord(intentId, requester, token, 0, reservedSolver, expiry, EscrowState.CANCELLED, requester);
    }
}
