package decentralabs.gmp.service.hub;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import decentralabs.gmp.dto.message.EscrowConfirmation;
import decentralabs.gmp.dto.message.FulfillmentProof;
import decentralabs.gmp.dto.message.IntentRequirements;
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
 * Hub-side intent bookkeeping. Outflow intents lock the requester's hub tokens and
 * are settled by a fulfillment proof from the connected chain; inflow intents wait
 * for the connected chain's escrow confirmation and are settled by a solver paying
 * on the hub, which then emits the proof that releases the escrow.
 */
@Slf4j
public class HubIntentService implements MessageHandler {

    private final ChainContext chain;
    private final Bytes32 address;
    private final Map<Bytes32, HubIntentRecord> intents = new ConcurrentHashMap<>();

    public HubIntentService(ChainContext chain, Bytes32 address) {
        this.chain = chain;
        this.address = address;
    }

    @Override
    public Bytes32 address() {
        return address;
    }

    public Optional<HubIntentRecord> find(Bytes32 intentId) {
        return Optional.ofNullable(intents.get(intentId));
    }

    public HubIntentRecord createOutflowIntent(Bytes32 requester, HubIntentRequest request) {
        return chain.atomically(() -> {
            validateNew(request);
            chain.getTokens().transfer(request.hubToken(), requester, address, request.hubAmount());
            HubIntentRecord record = new HubIntentRecord(request.intentId(), IntentDirection.OUTFLOW, requester,
                request, HubIntentStatus.REQUIREMENTS_SENT, 0L, Bytes32.ZERO);
            register(requester, record);
            return record;
        });
    }

    public HubIntentRecord createInflowIntent(Bytes32 requester, HubIntentRequest request) {
        return chain.atomically(() -> {
            validateNew(request);
            // the connected escrow pays exactly one solver, so it must be known up front
            if (request.solver() == null || request.solver().isZero()) {
                throw new GmpException(GmpErrorCode.INVALID_SOLVER, "Inflow intents must name the solver");
            }
            HubIntentRecord record = new HubIntentRecord(request.intentId(), IntentDirection.INFLOW, requester,
                request, HubIntentStatus.AWAITING_ESCROW, 0L, Bytes32.ZERO);
            register(requester, record);
            return record;
        });
    }

    /**
     * Pays the requester on the hub for a confirmed inflow escrow and sends the proof
     * that releases the escrow to {@code solver}.
     */
    public HubIntentRecord fulfillInflowIntent(Bytes32 solver, Bytes32 intentId) {
        return chain.atomically(() -> {
            HubIntentRecord record = requireIntent(intentId);
            if (record.direction() != IntentDirection.INFLOW) {
                throw new GmpException(GmpErrorCode.DIRECTION_MISMATCH,
                    "Intent " + intentId + " is an outflow intent and settles on the connected chain");
            }
            switch (record.status()) {
                case AWAITING_ESCROW:
                    throw new GmpException(GmpErrorCode.ESCROW_NOT_CONFIRMED, "Escrow for intent " + intentId + " not confirmed yet");
                case FULFILLED:
                    throw new GmpException(GmpErrorCode.ALREADY_FULFILLED, "Intent " + intentId + " already fulfilled");
                case CANCELLED:
                    throw new GmpException(GmpErrorCode.EXPIRED, "Intent " + intentId + " was cancelled");
                default:
                    break;
            }
            HubIntentRequest request = record.request();
            long now = chain.now();
            if (Long.compareUnsigned(now, request.expiry()) > 0) {
                throw new GmpException(GmpErrorCode.EXPIRED, "Intent " + intentId + " has expired");
            }
            if (!request.solver().isZero() && !request.solver().equals(solver)) {
                throw new GmpException(GmpErrorCode.UNAUTHORIZED_SOLVER, "Intent " + intentId + " is reserved for another solver");
            }

            chain.getTokens().transfer(request.hubToken(), solver, record.requester(), request.hubAmount());
            HubIntentRecord fulfilled = record.fulfilled(solver);
            ChainTransaction tx = chain.currentTransaction();
            tx.put(intents, intentId, fulfilled);

            FulfillmentProof proof = new FulfillmentProof(intentId, solver, record.amountEscrowed(), now);
            chain.getEndpoint().send(address, request.connectedChainId(), request.connectedHandler(), MessageCodec.encode(proof));
            tx.afterCommit(() -> log.info("Inflow intent fulfilled on hub: intent={}, solver={}",
                LogSanitizer.shortHex(intentId), LogSanitizer.shortHex(solver)));
            return fulfilled;
        });
    }

    /**
     * Refunds the requester of an unsettled intent after expiry. Inflow intents lock
     * nothing on the hub and are only closed.
     */
    public HubIntentRecord cancelIntent(Bytes32 caller, Bytes32 intentId) {
        return chain.atomically(() -> {
            HubIntentRecord record = requireIntent(intentId);
            if (!record.requester().equals(caller)) {
                throw new GmpException(GmpErrorCode.UNAUTHORIZED_REQUESTER, "Only the requester can cancel intent " + intentId);
            }
            if (record.status().isTerminal()) {
                throw new GmpException(GmpErrorCode.ALREADY_FULFILLED,
                    "Intent " + intentId + " is already " + record.status().getWireValue());
            }
            if (Long.compareUnsigned(chain.now(), record.request().expiry()) <= 0) {
                throw new GmpException(GmpErrorCode.NOT_EXPIRED_YET, "Intent " + intentId + " has not expired yet");
            }
            if (record.direction() == IntentDirection.OUTFLOW) {
                chain.getTokens().transfer(record.request().hubToken(), address, record.requester(), record.request().hubAmount());
            }
            HubIntentRecord cancelled = record.withStatus(HubIntentStatus.CANCELLED);
            ChainTransaction tx = chain.currentTransaction();
            tx.put(intents, intentId, cancelled);
            tx.afterCommit(() -> log.info("Hub intent cancelled: intent={}, direction={}",
                LogSanitizer.shortHex(intentId), record.direction().getWireValue()));
            return cancelled;
        });
    }

    @Override
    public void receive(InboundMessage message) {
        switch (message.type()) {
            case ESCROW_CONFIRMATION:
                onEscrowConfirmation(message, MessageCodec.decodeConfirmation(message.payload()));
                break;
            case FULFILLMENT_PROOF:
                onFulfillmentProof(message, MessageCodec.decodeProof(message.payload()));
                break;
            default:
                throw new GmpException(GmpErrorCode.HANDLER_NOT_CONFIGURED, "Hub handler does not accept " + message.type().getWireValue());
        }
    }

    private void onEscrowConfirmation(InboundMessage message, EscrowConfirmation confirmation) {
        HubIntentRecord record = intents.get(confirmation.intentId());
        if (record == null || record.direction() != IntentDirection.INFLOW) {
            log.debug("Escrow confirmation for untracked intent {}", LogSanitizer.shortHex(confirmation.intentId()));
            return;
        }
        HubIntentRequest request = record.request();
        if (message.srcChainId() != request.connectedChainId()) {
            log.warn("Escrow confirmation for intent {} arrived from chain {}, expected {}",
                LogSanitizer.shortHex(confirmation.intentId()), message.srcChainId(), request.connectedChainId());
            return;
        }
        if (record.status() != HubIntentStatus.AWAITING_ESCROW) {
            log.warn("Escrow confirmation for intent {} ignored in state {}",
                LogSanitizer.shortHex(confirmation.intentId()), record.status().getWireValue());
            return;
        }
        if (Long.compareUnsigned(confirmation.amountEscrowed(), request.connectedAmount()) < 0
            || !confirmation.tokenAddr().equals(request.connectedToken())) {
            log.warn("Escrow confirmation for intent {} does not match requirements: amount={}, token={}",
                LogSanitizer.shortHex(confirmation.intentId()), Uint64.toString(confirmation.amountEscrowed()),
                LogSanitizer.shortHex(confirmation.tokenAddr()));
            return;
        }
        ChainTransaction tx = chain.currentTransaction();
        tx.put(intents, record.intentId(), record.escrowConfirmed(confirmation.amountEscrowed()));
        tx.afterCommit(() -> log.info("Escrow confirmed on hub: intent={}, amount={}",
            LogSanitizer.shortHex(record.intentId()), Uint64.toString(confirmation.amountEscrowed())));
    }

    private void onFulfillmentProof(InboundMessage message, FulfillmentProof proof) {
        HubIntentRecord record = intents.get(proof.intentId());
        if (record == null || record.direction() != IntentDirection.OUTFLOW) {
            log.debug("Fulfillment proof for untracked intent {}", LogSanitizer.shortHex(proof.intentId()));
            return;
        }
        HubIntentRequest request = record.request();
        if (message.srcChainId() != request.connectedChainId()) {
            log.warn("Fulfillment proof for intent {} arrived from chain {}, expected {}",
                LogSanitizer.shortHex(proof.intentId()), message.srcChainId(), request.connectedChainId());
            return;
        }
        if (record.status() != HubIntentStatus.REQUIREMENTS_SENT) {
            // a proof after cancellation means the solver paid after the requester was refunded
            log.error("Fulfillment proof for intent {} ignored in state {}, solver={}",
                LogSanitizer.shortHex(proof.intentId()), record.status().getWireValue(), LogSanitizer.shortHex(proof.solverAddr()));
            return;
        }
        Bytes32 payee = request.solver().isZero() ? proof.solverAddr() : request.solver();
        chain.getTokens().transfer(request.hubToken(), address, payee, request.hubAmount());
        ChainTransaction tx = chain.currentTransaction();
        tx.put(intents, record.intentId(), record.fulfilled(payee));
        tx.afterCommit(() -> log.info("Outflow intent settled on hub: intent={}, solver={}, amount={}",
            LogSanitizer.shortHex(record.intentId()), LogSanitizer.shortHex(payee), Uint64.toString(request.hubAmount())));
    }

    private HubIntentRecord requireIntent(Bytes32 intentId) {
        HubIntentRecord record = intents.get(intentId);
        if (record == null) {
            throw new GmpException(GmpErrorCode.DOES_NOT_EXIST, "No hub intent " + intentId);
        }
        return record;
    }

    private void validateNew(HubIntentRequest request) {
        if (request.hubAmount() == 0 || request.connectedAmount() == 0) {
            throw new GmpException(GmpErrorCode.ZERO_AMOUNT, "Intent amounts must be greater than zero");
        }
        if (intents.containsKey(request.intentId())) {
            throw new GmpException(GmpErrorCode.ALREADY_EXISTS, "Intent already exists: " + request.intentId());
        }
        if (Long.compareUnsigned(request.expiry(), chain.now()) <= 0) {
            throw new GmpException(GmpErrorCode.EXPIRED, "Intent expiry must be in the future");
        }
        if (!chain.getEndpoint().hasRemoteEndpoint(request.connectedChainId())) {
            throw new GmpException(GmpErrorCode.NO_REMOTE_ENDPOINT,
                "Chain " + request.connectedChainId() + " is not connected to the hub");
        }
    }

    private void register(Bytes32 requester, HubIntentRecord record) {
        HubIntentRequest request = record.request();
        Bytes32 recipient = request.connectedRequester() == null || request.connectedRequester().isZero()
            ? requester : request.connectedRequester();
        IntentRequirements requirements = new IntentRequirements(request.intentId(), recipient,
            request.connectedAmount(), request.connectedToken(), request.solver(), request.expiry());

        ChainTransaction tx = chain.currentTransaction();
        tx.put(intents, record.intentId(), record);
        chain.getEndpoint().send(address, request.connectedChainId(), request.connectedHandler(), MessageCodec.encode(requirements));
        tx.afterCommit(() -> log.info("Hub {} intent created: intent={}, connectedChain={}, expiry={}",
            record.direction().getWireValue(), LogSanitizer.shortHex(record.intentId()),
            request.connectedChainId(), request.expiry()));
    }
}
