package decentralabs.gmp.service.outflow;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import decentralabs.gmp.dto.message.FulfillmentProof;
import decentralabs.gmp.dto.message.IntentRequirements;
import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.chain.ChainContext;
import decentralabs.gmp.service.chain.ChainTransaction;
import decentralabs.gmp.service.codec.MessageCodec;
import decentralabs.gmp.service.endpoint.InboundMessage;
import decentralabs.gmp.service.endpoint.MessageHandler;
import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.LogSanitizer;
import decentralabs.gmp.util.Uint64;
import lombok.extern.slf4j.Slf4j;

/**
 * Connected-chain validator for value flowing out of the hub. Stores the hub's
 * requirements and lets a solver satisfy them by paying the requester here, which
 * emits a fulfillment proof back to the hub.
 */
@Slf4j
public class OutflowValidatorService implements MessageHandler {

    private final ChainContext chain;
    private final Bytes32 address;
    private final Map<Bytes32, OutflowRequirements> requirements = new ConcurrentHashMap<>();

    public OutflowValidatorService(ChainContext chain, Bytes32 address) {
        this.chain = chain;
        this.address = address;
    }

    @Override
    public Bytes32 address() {
        return address;
    }

    public Optional<OutflowRequirements> find(Bytes32 intentId) {
        return Optional.ofNullable(requirements.get(intentId));
    }

    @Override
    public void receive(InboundMessage message) {
        if (message.type() != MessageType.INTENT_REQUIREMENTS) {
            throw new GmpException(GmpErrorCode.HANDLER_NOT_CONFIGURED, "Outflow validator does not accept " + message.type().getWireValue());
        }
        IntentRequirements req = MessageCodec.decodeRequirements(message.payload());
        if (requirements.containsKey(req.intentId())) {
            log.warn("Duplicate intent requirements ignored for intent {}", LogSanitizer.shortHex(req.intentId()));
            return;
        }
        OutflowRequirements stored = new OutflowRequirements(req.intentId(), req.requesterAddr(), req.amountRequired(),
            req.tokenAddr(), req.solverAddr(), req.expiry(), message.srcChainId(), message.srcAddr(), false, null);
        ChainTransaction tx = chain.currentTransaction();
        tx.put(requirements, req.intentId(), stored);
        tx.afterCommit(() -> log.info("Outflow requirements stored: intent={}, amount={}, expiry={}",
            LogSanitizer.shortHex(req.intentId()), Uint64.toString(req.amountRequired()), Long.toUnsignedString(req.expiry())));
    }

    /**
     * Pays the requester on behalf of {@code solver} and reports the fulfillment to
     * the chain the requirements came from.
     *
     * @return nonce of the emitted proof
     */
    public long fulfillIntent(Bytes32 solver, Bytes32 intentId, Bytes32 token) {
        return chain.atomically(() -> {
            OutflowRequirements req = requirements.get(intentId);
            if (req == null) {
                throw new GmpException(GmpErrorCode.REQUIREMENTS_NOT_FOUND, "No requirements for intent " + intentId);
            }
            if (req.fulfilled()) {
                throw new GmpException(GmpErrorCode.ALREADY_FULFILLED, "Intent " + intentId + " already fulfilled");
            }
            long now = chain.now();
            if (Long.compareUnsigned(now, req.expiry()) > 0) {
                throw new GmpException(GmpErrorCode.EXPIRED, "Intent " + intentId + " expired");
            }
            if (req.isSolverPinned() && !req.solverAddr().equals(solver)) {
                throw new GmpException(GmpErrorCode.UNAUTHORIZED_SOLVER, "Intent " + intentId + " is reserved for another solver");
            }
            if (!req.tokenAddr().equals(token)) {
                throw new GmpException(GmpErrorCode.TOKEN_MISMATCH, "Token does not match intent requirements");
            }

            chain.getTokens().transfer(token, solver, req.requesterAddr(), req.amountRequired());
            ChainTransaction tx = chain.currentTransaction();
            tx.put(requirements, intentId, req.fulfilledBy(solver));

            FulfillmentProof proof = new FulfillmentProof(intentId, solver, req.amountRequired(), now);
            long nonce = chain.getEndpoint().send(address, req.srcChainId(), req.srcAddr(), MessageCodec.encode(proof));
            tx.afterCommit(() -> log.info("Outflow intent fulfilled: intent={}, solver={}, amount={}",
                LogSanitizer.shortHex(intentId), LogSanitizer.shortHex(solver), Uint64.toString(req.amountRequired())));
            return nonce;
        });
    }
}
