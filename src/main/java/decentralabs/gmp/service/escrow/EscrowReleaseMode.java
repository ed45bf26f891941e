package decentralabs.gmp.service.escrow;

/**
 * How an open escrow may be released to its solver on a given deployment.
 */
public enum EscrowReleaseMode {
    /** A {@code FulfillmentProof} delivered through the endpoint releases the escrow. */
    GMP,
    /** A signature from the configured approver over the intent id releases the escrow. */
    SIGNATURE
}
