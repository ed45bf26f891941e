package decentralabs.gmp.service.endpoint;

import decentralabs.gmp.util.Bytes32;

/**
 * Local program receiving routed messages. A registered handler may also send.
 */
public interface MessageHandler {

    /**
     * Local address of the handler; outbound messages carry it as source address.
     */
    Bytes32 address();

    /**
     * Called inside the delivery transaction; throwing rolls the delivery back.
     */
    void receive(InboundMessage message);
}
