package decentralabs.gmp.exception;

/**
 * Exception thrown when a GMP, escrow or outflow operation is rejected.
 */
public class GmpException extends RuntimeException {

    private final GmpErrorCode code;

    public GmpException(GmpErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GmpException(GmpErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public GmpErrorCode getCode() {
        return code;
    }
}
