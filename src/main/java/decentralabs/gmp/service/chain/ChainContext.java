package decentralabs.gmp.service.chain;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.endpoint.DeliveryLedger;
import decentralabs.gmp.service.endpoint.EndpointRegistry;
import decentralabs.gmp.service.endpoint.OutboundMailbox;
import decentralabs.gmp.service.escrow.InflowEscrowService;
import decentralabs.gmp.service.hub.HubIntentService;
import decentralabs.gmp.service.ledger.TokenLedger;
import decentralabs.gmp.service.outflow.OutflowValidatorService;
import decentralabs.gmp.util.Bytes32;

/**
 * Everything one logical chain owns: endpoint, delivery ledger, mailbox, balances and
 * the role services bound on it. Instances are independent; nothing is shared
 * between two chains except what travels through the relay.
 */
public class ChainContext {

    private final long chainId;
    private final Clock clock;
    private final ChainTransactionManager transactions;
    private final DeliveryLedger deliveryLedger;
    private final OutboundMailbox mailbox;
    private final TokenLedger tokens;
    private final EndpointRegistry endpoint;

    private volatile InflowEscrowService escrow;
    private volatile OutflowValidatorService outflow;
    private volatile HubIntentService hub;

    public ChainContext(long chainId, Bytes32 admin, Clock clock) {
        if (chainId < 0 || chainId > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("Chain id must be an unsigned 32-bit value: " + chainId);
        }
        this.chainId = chainId;
        this.clock = clock;
        this.transactions = new ChainTransactionManager(chainId);
        this.deliveryLedger = new DeliveryLedger(transactions);
        this.mailbox = new OutboundMailbox(chainId, clock, transactions);
        this.tokens = new TokenLedger(transactions);
        this.endpoint = new EndpointRegistry(chainId, admin, transactions, deliveryLedger, mailbox);
    }

    public long getChainId() {
        return chainId;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Chain time in unix seconds.
     */
    public long now() {
        return clock.instant().getEpochSecond();
    }

    public <T> T atomically(Supplier<T> work) {
        return transactions.execute(work);
    }

    public void atomically(Runnable work) {
        transactions.execute(work);
    }

    public ChainTransaction currentTransaction() {
        return transactions.current();
    }

    public DeliveryLedger getDeliveryLedger() {
        return deliveryLedger;
    }

    public OutboundMailbox getMailbox() {
        return mailbox;
    }

    public TokenLedger getTokens() {
        return tokens;
    }

    public EndpointRegistry getEndpoint() {
        return endpoint;
    }

    public void attach(InflowEscrowService escrow) {
        this.escrow = escrow;
    }

    public void attach(OutflowValidatorService outflow) {
        this.outflow = outflow;
    }

    public void attach(HubIntentService hub) {
        this.hub = hub;
    }

    public Optional<InflowEscrowService> findEscrow() {
        return Optional.ofNullable(escrow);
    }

    public Optional<OutflowValidatorService> findOutflow() {
        return Optional.ofNullable(outflow);
    }

    public Optional<HubIntentService> findHub() {
        return Optional.ofNullable(hub);
    }

    public InflowEscrowService escrow() {
        return findEscrow().orElseThrow(() -> roleMissing("inflow escrow"));
    }

    public OutflowValidatorService outflow() {
        return findOutflow().orElseThrow(() -> roleMissing("outflow validator"));
    }

    public HubIntentService hub() {
        return findHub().orElseThrow(() -> roleMissing("hub intent"));
    }

    private GmpException roleMissing(String role) {
        return new GmpException(GmpErrorCode.HANDLER_NOT_CONFIGURED, "Chain " + chainId + " does not host the " + role + " role");
    }
}
