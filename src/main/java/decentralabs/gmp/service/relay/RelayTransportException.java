package decentralabs.gmp.service.relay;

/**
 * The remote chain could not be reached or answered with something other than an
 * endpoint error. Always retried.
 */
public class RelayTransportException extends RuntimeException {

    public RelayTransportException(String message) {
        super(message);
    }

    public RelayTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
