package decentralabs.gmp.controller;

/**
 * Request headers identifying the caller of a state-changing call.
 */
final class CallerHeaders {

    /** 32-byte hex address acting as the transaction sender. */
    static final String CALLER = "X-Caller";

    /** 32-byte hex identity of the delivering relay. */
    static final String RELAY = "X-Relay-Id";

    private CallerHeaders() {
    }
}
