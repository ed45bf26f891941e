package decentralabs.gmp.service.escrow;

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
 * Connected-chain escrow for value flowing toward the hub.
 *
 * <p>The requester locks tokens against an intent id; the escrow is released to the
 * solver reserved at creation when a fulfillment proof arrives (or, in signature
 * mode, when the approver signs the intent id), or refunded after expiry.
 */
@Slf4j
public class InflowEscrowService implements MessageHandler {

    public static final long DEFAULT_EXPIRY_SECONDS = 120;

    private final ChainContext chain;
    private final Bytes32 address;
    private final EscrowReleaseMode releaseMode;
    private final EscrowClaimVerifier claimVerifier;
    private final long defaultExpirySeconds;

    private final Map<Bytes32, EscrowRecord> escrows = new ConcurrentHashMap<>();
    private final Map<Bytes32, StoredRequirements> requirements = new ConcurrentHashMap<>();

    public InflowEscrowService(
        ChainContext chain,
        Bytes32 address,
        EscrowReleaseMode releaseMode,
        EscrowClaimVerifier claimVerifier,
        long defaultExpirySeconds
    ) {
        this.chain = chain;
        this.address = address;
        this.releaseMode = releaseMode;
        this.claimVerifier = claimVerifier;
        this.defaultExpirySeconds = defaultExpirySeconds > 0 ? defaultExpirySeconds : DEFAULT_EXPIRY_SECONDS;
    }

    @Override
    public Bytes32 address() {
        return address;
    }

    public EscrowReleaseMode getReleaseMode() {
        return releaseMode;
    }

    public Optional<EscrowRecord> find(Bytes32 intentId) {
        return Optional.ofNullable(escrows.get(intentId));
    }

    public Optional<IntentRequirements> findRequirements(Bytes32 intentId) {
        return Optional.ofNullable(requirements.get(intentId)).map(StoredRequirements::requirements);
    }

    /**
     * Locks {@code amount} of {@code token} from the requester in custody.
     *
     * <p>When the hub already delivered requirements for {@code intentId}, the escrow is
     * bound to them: the caller must be the requirements' requester, the reserved solver
     * and the expiry are taken from the requirements, and a confirmation is sent back.
     *
     * @param solver         solver the escrow pays on release; zero takes the solver
     *                       pinned by the hub requirements
     * @param expiryDuration seconds until the requester may cancel; null or
     *                       non-positive selects the deployment default. Ignored when
     *                       hub requirements exist.
     */
    public EscrowRecord create(
        Bytes32 requester,
        Bytes32 intentId,
        long amount,
        Bytes32 token,
        Bytes32 solver,
        Long expiryDuration
    ) {
        return chain.atomically(() -> {
            if (amount == 0) {
                throw new GmpException(GmpErrorCode.ZERO_AMOUNT, "Escrow amount must be greater than zero");
            }
            if (escrows.containsKey(intentId)) {
                throw new GmpException(GmpErrorCode.ALREADY_EXISTS, "Escrow already exists for intent " + intentId);
            }
            ChainTransaction tx = chain.currentTransaction();

            Bytes32 reservedSolver = solver == null ? Bytes32.ZERO : solver;
            long expiry;
            StoredRequirements stored = requirements.get(intentId);
            if (stored != null) {
                IntentRequirements req = stored.requirements();
                if (stored.escrowCreated()) {
                    throw new GmpException(GmpErrorCode.ESCROW_ALREADY_CREATED, "Escrow already created for intent " + intentId);
                }
                if (!requester.equals(req.requesterAddr())) {
                    throw new GmpException(GmpErrorCode.UNAUTHORIZED_REQUESTER,
                        "Intent " + intentId + " belongs to requester " + LogSanitizer.shortHex(req.requesterAddr()));
                }
                if (reservedSolver.isZero()) {
                    reservedSolver = req.solverAddr();
                } else if (!req.solverAddr().isZero() && !reservedSolver.equals(req.solverAddr())) {
                    throw new GmpException(GmpErrorCode.UNAUTHORIZED_SOLVER,
                        "Intent " + intentId + " is reserved for solver " + LogSanitizer.shortHex(req.solverAddr()));
                }
                if (Long.compareUnsigned(amount, req.amountRequired()) < 0) {
                    throw new GmpException(GmpErrorCode.AMOUNT_MISMATCH,
                        "Escrow amount " + Uint64.toString(amount) + " below required " + Uint64.toString(req.amountRequired()));
                }
                if (!token.equals(req.tokenAddr())) {
                    throw new GmpException(GmpErrorCode.TOKEN_MISMATCH, "Escrow token does not match intent requirements");
                }
                if (Long.compareUnsigned(chain.now(), req.expiry()) > 0) {
                    throw new GmpException(GmpErrorCode.EXPIRED, "Intent " + intentId + " expired on the hub");
                }
                expiry = req.expiry();
            } else {
                expiry = expiryFrom(expiryDuration);
            }
            if (reservedSolver.isZero()) {
                throw new GmpException(GmpErrorCode.INVALID_SOLVER, "Escrow requires a reserved solver");
            }

            chain.getTokens().transfer(token, requester, address, amount);

            EscrowRecord record = EscrowRecord.open(intentId, requester, token, amount, reservedSolver, expiry);
            tx.put(escrows, intentId, record);

            if (stored != null) {
                tx.put(requirements, intentId, stored.withEscrowCreated());
                EscrowConfirmation confirmation = new EscrowConfirmation(intentId, intentId, amount, token, requester);
                chain.getEndpoint().send(address, stored.srcChainId(), stored.srcAddr(), MessageCodec.encode(confirmation));
            }

            tx.afterCommit(() -> log.info("Escrow created: intent={}, amount={}, expiry={}",
                LogSanitizer.shortHex(intentId), Uint64.toString(amount), record.expiry()));
            return record;
        });
    }

    /**
     * Refunds an open escrow to its requester once {@code now > expiry}.
     */
    public EscrowRecord cancel(Bytes32 caller, Bytes32 intentId) {
        return chain.atomically(() -> {
            EscrowRecord escrow = requireEscrow(intentId);
            if (!escrow.requester().equals(caller)) {
                throw new GmpException(GmpErrorCode.UNAUTHORIZED_REQUESTER, "Only the requester can cancel the escrow");
            }
            requireOpen(escrow);
            if (Long.compareUnsigned(chain.now(), escrow.expiry()) <= 0) {
                throw new GmpException(GmpErrorCode.NOT_EXPIRED_YET, "Escrow for intent " + intentId + " has not expired yet");
            }
            chain.getTokens().transfer(escrow.token(), address, escrow.requester(), escrow.amount());
            EscrowRecord cancelled = escrow.cancelled();
            chain.currentTransaction().put(escrows, intentId, cancelled);
            chain.currentTransaction().afterCommit(() -> log.info("Escrow cancelled: intent={}, refunded={}",
                LogSanitizer.shortHex(intentId), Uint64.toString(escrow.amount())));
            return cancelled;
        });
    }

    /**
     * Releases an open escrow to its reserved solver on a valid approver signature.
     * Only available on deployments using {@link EscrowReleaseMode#SIGNATURE}.
     */
    public EscrowRecord claim(Bytes32 intentId, String signature) {
        return chain.atomically(() -> {
            if (releaseMode != EscrowReleaseMode.SIGNATURE) {
                throw new GmpException(GmpErrorCode.RELEASE_MODE_MISMATCH, "Escrows on chain " + chain.getChainId() + " are released by fulfillment proof");
            }
            EscrowRecord escrow = requireEscrow(intentId);
            requireOpen(escrow);
            if (Long.compareUnsigned(chain.now(), escrow.expiry()) > 0) {
                throw new GmpException(GmpErrorCode.EXPIRED, "Escrow for intent " + intentId + " has expired");
            }
            if (!claimVerifier.verify(intentId, signature)) {
                throw new GmpException(GmpErrorCode.INVALID_SIGNATURE, "Claim signature is not from the approver");
            }
            return release(escrow, escrow.reservedSolver());
        });
    }

    @Override
    public void receive(InboundMessage message) {
        switch (message.type()) {
            case INTENT_REQUIREMENTS:
                onIntentRequirements(message, MessageCodec.decodeRequirements(message.payload()));
                break;
            case FULFILLMENT_PROOF:
                onFulfillmentProof(MessageCodec.decodeProof(message.payload()));
                break;
            default:
                throw new GmpException(GmpErrorCode.HANDLER_NOT_CONFIGURED, "Escrow handler does not accept " + message.type().getWireValue());
        }
    }

    private void onIntentRequirements(InboundMessage message, IntentRequirements req) {
        if (requirements.containsKey(req.intentId())) {
            log.warn("Duplicate intent requirements ignored for intent {}", LogSanitizer.shortHex(req.intentId()));
            return;
        }
        ChainTransaction tx = chain.currentTransaction();
        tx.put(requirements, req.intentId(), new StoredRequirements(req, message.srcChainId(), message.srcAddr(), false));
        tx.afterCommit(() -> log.info("Escrow requirements stored: intent={}, amount={}",
            LogSanitizer.shortHex(req.intentId()), Uint64.toString(req.amountRequired())));
    }

    private void onFulfillmentProof(FulfillmentProof proof) {
        if (releaseMode != EscrowReleaseMode.GMP) {
            throw new GmpException(GmpErrorCode.RELEASE_MODE_MISMATCH, "Escrows on chain " + chain.getChainId() + " are released by signature");
        }
        EscrowRecord escrow = requireEscrow(proof.intentId());
        requireOpen(escrow);
        if (!proof.solverAddr().equals(escrow.reservedSolver())) {
            log.warn("Fulfillment proof for intent {} names solver {}, paying reserved solver {}",
                LogSanitizer.shortHex(proof.intentId()), LogSanitizer.shortHex(proof.solverAddr()),
                LogSanitizer.shortHex(escrow.reservedSolver()));
        }
        release(escrow, escrow.reservedSolver());
    }

    private EscrowRecord release(EscrowRecord escrow, Bytes32 payee) {
        chain.getTokens().transfer(escrow.token(), address, payee, escrow.amount());
        EscrowRecord released = escrow.released(payee);
        ChainTransaction tx = chain.currentTransaction();
        tx.put(escrows, escrow.intentId(), released);
        tx.afterCommit(() -> log.info("Escrow released: intent={}, solver={}, amount={}",
            LogSanitizer.shortHex(escrow.intentId()), LogSanitizer.shortHex(payee), Uint64.toString(escrow.amount())));
        return released;
    }

    private long expiryFrom(Long expiryDuration) {
        long duration = expiryDuration == null || expiryDuration <= 0 ? defaultExpirySeconds : expiryDuration;
        try {
            return Math.addExact(chain.now(), duration);
        } catch (ArithmeticException e) {
            throw new GmpException(GmpErrorCode.INVALID_EXPIRY, "Escrow expiry duration too large: " + duration);
        }
    }

    private EscrowRecord requireEscrow(Bytes32 intentId) {
        EscrowRecord escrow = escrows.get(intentId);
        if (escrow == null) {
            throw new GmpException(GmpErrorCode.DOES_NOT_EXIST, "No escrow for intent " + intentId);
        }
        return escrow;
    }

    private void requireOpen(EscrowRecord escrow) {
        if (escrow.state() != EscrowState.OPEN) {
            throw new GmpException(GmpErrorCode.ALREADY_RELEASED,
                "Escrow for intent " + escrow.intentId() + " is already " + escrow.state().getWireValue());
        }
    }

    private record StoredRequirements(IntentRequirements requirements, long srcChainId, Bytes32 srcAddr, boolean escrowCreated) {

        StoredRequirements withEscrowCreated() {
            return new StoredRequirements(requirements, srcChainId, srcAddr, true);
        }
    }
}
