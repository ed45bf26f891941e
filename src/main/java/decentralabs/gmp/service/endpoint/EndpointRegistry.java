package decentralabs.gmp.service.endpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.chain.ChainTransactionManager;
import decentralabs.gmp.service.codec.MessageCodec;
import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-chain GMP endpoint: authorized relays, trusted remote senders per source chain,
 * message type bindings, and the {@code deliver}/{@code send} entry points.
 */
@Slf4j
public class EndpointRegistry {

    private final long chainId;
    private final Bytes32 admin;
    private final ChainTransactionManager transactions;
    private final DeliveryLedger deliveryLedger;
    private final OutboundMailbox mailbox;

    private final Set<Bytes32> relays = ConcurrentHashMap.newKeySet();
    private final Map<Long, Set<Bytes32>> remoteEndpoints = new ConcurrentHashMap<>();
    private final Map<Bytes32, MessageHandler> handlers = new ConcurrentHashMap<>();
    private final Map<MessageType, List<MessageHandler>> bindings = Collections.synchronizedMap(new EnumMap<>(MessageType.class));
    private final Set<MessageType> ignoredTypes = Collections.synchronizedSet(EnumSet.noneOf(MessageType.class));

    public EndpointRegistry(
        long chainId,
        Bytes32 admin,
        ChainTransactionManager transactions,
        DeliveryLedger deliveryLedger,
        OutboundMailbox mailbox
    ) {
        this.chainId = chainId;
        this.admin = admin;
        this.transactions = transactions;
        this.deliveryLedger = deliveryLedger;
        this.mailbox = mailbox;
        // the admin starts out as an authorized relay
        this.relays.add(admin);
    }

    public long getChainId() {
        return chainId;
    }

    public Bytes32 getAdmin() {
        return admin;
    }

    // ------------------------------------------------------------------
    // Relay authorization
    // ------------------------------------------------------------------

    public void addRelay(Bytes32 caller, Bytes32 relay) {
        requireAdmin(caller);
        if (!relays.add(relay)) {
            throw new GmpException(GmpErrorCode.ALREADY_EXISTS, "Relay already authorized: " + relay);
        }
        log.info("Chain {}: relay {} added", chainId, LogSanitizer.shortHex(relay));
    }

    public void removeRelay(Bytes32 caller, Bytes32 relay) {
        requireAdmin(caller);
        if (!relays.remove(relay)) {
            throw new GmpException(GmpErrorCode.NOT_FOUND, "Relay not authorized: " + relay);
        }
        log.info("Chain {}: relay {} removed", chainId, LogSanitizer.shortHex(relay));
    }

    public boolean isRelayAuthorized(Bytes32 relay) {
        return relay != null && relays.contains(relay);
    }

    // ------------------------------------------------------------------
    // Trusted remote endpoints
    // ------------------------------------------------------------------

    /**
     * Replaces every trusted sender for {@code srcChainId} with {@code addr}.
     */
    public void setRemoteEndpoint(Bytes32 caller, long srcChainId, Bytes32 addr) {
        requireAdmin(caller);
        Set<Bytes32> trusted = ConcurrentHashMap.newKeySet();
        trusted.add(addr);
        remoteEndpoints.put(srcChainId, trusted);
        log.info("Chain {}: remote endpoint for chain {} set to {}", chainId, srcChainId, LogSanitizer.shortHex(addr));
    }

    /**
     * Adds another trusted sender for {@code srcChainId}, e.g. while migrating handlers.
     */
    public void addRemoteEndpoint(Bytes32 caller, long srcChainId, Bytes32 addr) {
        requireAdmin(caller);
        remoteEndpoints.computeIfAbsent(srcChainId, id -> ConcurrentHashMap.newKeySet()).add(addr);
        log.info("Chain {}: remote endpoint {} added for chain {}", chainId, LogSanitizer.shortHex(addr), srcChainId);
    }

    public boolean hasRemoteEndpoint(long srcChainId) {
        Set<Bytes32> trusted = remoteEndpoints.get(srcChainId);
        return trusted != null && !trusted.isEmpty();
    }

    public Set<Bytes32> getRemoteEndpoints(long srcChainId) {
        return Set.copyOf(remoteEndpoints.getOrDefault(srcChainId, Set.of()));
    }

    public List<Long> getRemoteChainIds() {
        List<Long> ids = new ArrayList<>(remoteEndpoints.keySet());
        Collections.sort(ids);
        return ids;
    }

    // ------------------------------------------------------------------
    // Handlers
    // ------------------------------------------------------------------

    /**
     * Registers a local handler, allowing it to {@link #send}.
     */
    public void registerHandler(Bytes32 caller, MessageHandler handler) {
        requireAdmin(caller);
        handlers.put(handler.address(), handler);
    }

    /**
     * Routes {@code type} to {@code handler} in addition to already bound handlers.
     */
    public void bindHandler(Bytes32 caller, MessageType type, MessageHandler handler) {
        registerHandler(caller, handler);
        bindings.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
        ignoredTypes.remove(type);
        log.info("Chain {}: {} routed to handler {}", chainId, type.getWireValue(), LogSanitizer.shortHex(handler.address()));
    }

    /**
     * Declares that this chain does not play the role consuming {@code type}; such
     * messages are accepted and recorded without effect.
     */
    public void ignoreMessageType(Bytes32 caller, MessageType type) {
        requireAdmin(caller);
        if (!handlersFor(type).isEmpty()) {
            throw new GmpException(GmpErrorCode.ALREADY_EXISTS, type.getWireValue() + " already has bound handlers");
        }
        ignoredTypes.add(type);
    }

    public List<MessageHandler> handlersFor(MessageType type) {
        List<MessageHandler> bound = bindings.get(type);
        return bound == null ? List.of() : List.copyOf(bound);
    }

    public boolean isRegisteredHandler(Bytes32 addr) {
        return addr != null && handlers.containsKey(addr);
    }

    // ------------------------------------------------------------------
    // Inbound
    // ------------------------------------------------------------------

    /**
     * Accepts a message from an authorized relay. Authentication, the dedup check,
     * the ledger mark and every handler effect form one transaction: any failure
     * leaves the ledger unmarked so a corrected retry can still succeed.
     */
    public DeliveryReceipt deliver(Bytes32 relay, long srcChainId, Bytes32 srcAddr, byte[] payload) {
        return transactions.execute(() -> {
            if (!isRelayAuthorized(relay)) {
                throw new GmpException(GmpErrorCode.UNAUTHORIZED_RELAY,
                    "Caller " + LogSanitizer.shortHex(relay) + " is not an authorized relay");
            }
            if (!hasRemoteEndpoint(srcChainId)) {
                throw new GmpException(GmpErrorCode.NO_REMOTE_ENDPOINT,
                    "No remote endpoint configured for chain " + srcChainId);
            }
            if (!remoteEndpoints.get(srcChainId).contains(srcAddr)) {
                throw new GmpException(GmpErrorCode.UNREGISTERED_REMOTE_ENDPOINT,
                    "Source " + LogSanitizer.shortHex(srcAddr) + " is not trusted for chain " + srcChainId);
            }
            Bytes32 intentId = MessageCodec.peekIntentId(payload);
            MessageType type = MessageCodec.peekType(payload);

            Bytes32 key = DeliveryLedger.deliveryKey(intentId, type);
            if (deliveryLedger.isDelivered(key)) {
                throw new GmpException(GmpErrorCode.ALREADY_DELIVERED,
                    type.getWireValue() + " for intent " + intentId + " already delivered");
            }

            List<MessageHandler> targets = handlersFor(type);
            if (targets.isEmpty() && !ignoredTypes.contains(type)) {
                throw new GmpException(GmpErrorCode.HANDLER_NOT_CONFIGURED,
                    "Chain " + chainId + " has no handler for " + type.getWireValue());
            }

            // marked before handlers run so a re-entrant delivery sees the key
            deliveryLedger.markDelivered(key);

            InboundMessage inbound = new InboundMessage(srcChainId, srcAddr, type, intentId, payload.clone());
            for (MessageHandler handler : targets) {
                handler.receive(inbound);
            }

            transactions.current().afterCommit(() -> log.info(
                "Chain {}: delivered {} for intent {} from chain {} ({} handler(s))",
                chainId, type.getWireValue(), LogSanitizer.shortHex(intentId), srcChainId, targets.size()));
            return new DeliveryReceipt(chainId, srcChainId, intentId, type, key, targets.size());
        });
    }

    // ------------------------------------------------------------------
    // Outbound
    // ------------------------------------------------------------------

    /**
     * Appends a message to the outbound mailbox on behalf of a registered handler.
     *
     * @return the assigned nonce
     */
    public long send(Bytes32 caller, long dstChainId, Bytes32 dstAddr, byte[] payload) {
        return transactions.execute(() -> {
            if (!isRegisteredHandler(caller)) {
                throw new GmpException(GmpErrorCode.UNAUTHORIZED_SENDER,
                    "Only registered handlers can send, got " + LogSanitizer.shortHex(caller));
            }
            MessageType type = MessageCodec.peekType(payload);
            long nonce = mailbox.append(caller, dstChainId, dstAddr, payload);
            transactions.current().afterCommit(() -> log.info(
                "Chain {}: queued {} nonce={} to chain {} ({} bytes)",
                chainId, type.getWireValue(), nonce, dstChainId, payload.length));
            return nonce;
        });
    }

    public Set<Bytes32> getRelays() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(relays));
    }

    public List<MessageType> getIgnoredTypes() {
        synchronized (ignoredTypes) {
            return new ArrayList<>(ignoredTypes);
        }
    }

    private void requireAdmin(Bytes32 caller) {
        if (!admin.equals(caller)) {
            throw new GmpException(GmpErrorCode.UNAUTHORIZED_ADMIN,
                "Caller " + LogSanitizer.shortHex(caller) + " is not the endpoint admin");
        }
    }
}
