package decentralabs.gmp.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure reasons raised by the endpoint, the role services and the relay.
 */
public enum GmpErrorCode {
    // wire format
    EMPTY_PAYLOAD(HttpStatus.BAD_REQUEST),
    INVALID_LENGTH(HttpStatus.BAD_REQUEST),
    INVALID_PAYLOAD(HttpStatus.BAD_REQUEST),
    INVALID_MESSAGE_TYPE(HttpStatus.BAD_REQUEST),
    UNKNOWN_MESSAGE_TYPE(HttpStatus.BAD_REQUEST),

    // endpoint
    UNAUTHORIZED_ADMIN(HttpStatus.FORBIDDEN),
    UNAUTHORIZED_RELAY(HttpStatus.FORBIDDEN),
    UNAUTHORIZED_SENDER(HttpStatus.FORBIDDEN),
    NO_REMOTE_ENDPOINT(HttpStatus.FORBIDDEN),
    UNREGISTERED_REMOTE_ENDPOINT(HttpStatus.FORBIDDEN),
    HANDLER_NOT_CONFIGURED(HttpStatus.SERVICE_UNAVAILABLE),
    ALREADY_DELIVERED(HttpStatus.CONFLICT, true),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    UNKNOWN_CHAIN(HttpStatus.NOT_FOUND),

    // escrow and requirements
    ALREADY_EXISTS(HttpStatus.CONFLICT),
    ZERO_AMOUNT(HttpStatus.BAD_REQUEST),
    DOES_NOT_EXIST(HttpStatus.NOT_FOUND),
    ALREADY_RELEASED(HttpStatus.CONFLICT, true),
    ALREADY_FULFILLED(HttpStatus.CONFLICT, true),
    NOT_EXPIRED_YET(HttpStatus.CONFLICT),
    EXPIRED(HttpStatus.CONFLICT),
    UNAUTHORIZED_SOLVER(HttpStatus.FORBIDDEN),
    UNAUTHORIZED_REQUESTER(HttpStatus.FORBIDDEN),
    TOKEN_MISMATCH(HttpStatus.BAD_REQUEST),
    AMOUNT_MISMATCH(HttpStatus.BAD_REQUEST),
    REQUIREMENTS_NOT_FOUND(HttpStatus.NOT_FOUND),
    ESCROW_ALREADY_CREATED(HttpStatus.CONFLICT),
    ESCROW_NOT_CONFIRMED(HttpStatus.CONFLICT),
    DIRECTION_MISMATCH(HttpStatus.CONFLICT),
    INVALID_SIGNATURE(HttpStatus.FORBIDDEN),
    INVALID_SOLVER(HttpStatus.BAD_REQUEST),
    INVALID_EXPIRY(HttpStatus.BAD_REQUEST),
    RELEASE_MODE_MISMATCH(HttpStatus.CONFLICT),
    INSUFFICIENT_BALANCE(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;
    private final boolean deliveredEquivalent;

    GmpErrorCode(HttpStatus httpStatus) {
        this(httpStatus, false);
    }

    GmpErrorCode(HttpStatus httpStatus, boolean deliveredEquivalent) {
        this.httpStatus = httpStatus;
        this.deliveredEquivalent = deliveredEquivalent;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    /**
     * True when a relay seeing this failure may consider the message delivered: either the
     * ledger already holds it or the intent already reached a terminal state.
     */
    public boolean isDeliveredEquivalent() {
        return deliveredEquivalent;
    }
}
