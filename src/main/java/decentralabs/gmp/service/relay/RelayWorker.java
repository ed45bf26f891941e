package decentralabs.gmp.service.relay;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.endpoint.OutboundMessage;
import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves messages for one route. Entries are handled strictly in nonce order: a failed
 * delivery is retried before anything behind it, and the cursor only advances past
 * entries that were delivered, already delivered, or addressed to another chain.
 */
@Slf4j
public class RelayWorker {

    private final RelayRoute route;
    private final MailboxSource source;
    private final DeliveryTarget target;
    private final Bytes32 relayId;
    private final RelayCursorRepository cursors;
    private final BackoffPolicy backoff;
    private final Duration pollInterval;
    private final int batchSize;
    private final Clock clock;

    private long cursor;
    private long delivered;
    private long skipped;
    private int consecutiveFailures;
    private String lastError;
    private Instant lastDeliveryAt;

    public RelayWorker(
        RelayRoute route,
        MailboxSource source,
        DeliveryTarget target,
        Bytes32 relayId,
        RelayCursorRepository cursors,
        BackoffPolicy backoff,
        Duration pollInterval,
        int batchSize,
        Clock clock
    ) {
        this.route = route;
        this.source = source;
        this.target = target;
        this.relayId = relayId;
        this.cursors = cursors;
        this.backoff = backoff;
        this.pollInterval = pollInterval;
        this.batchSize = Math.max(1, batchSize);
        this.clock = clock;
        this.cursor = cursors.load(route);
    }

    public RelayRoute getRoute() {
        return route;
    }

    /**
     * Processes one batch.
     *
     * @return delay before the next call: zero when more entries are waiting, the poll
     *         interval when caught up, the backoff delay after a failure
     */
    public synchronized Duration runOnce() {
        List<OutboundMessage> batch;
        try {
            batch = source.fetchOutbound(cursor, batchSize);
        } catch (RuntimeException e) {
            return onFailure("read", cursor + 1, e);
        }
        if (batch.isEmpty()) {
            log.debug("Route {}: idle at nonce {}", route.name(), cursor);
            return pollInterval;
        }

        for (OutboundMessage message : batch) {
            if (message.dstChainId() != route.dstChainId()) {
                skipped++;
                advance(message.nonce());
                continue;
            }
            try {
                target.deliver(relayId, message.srcChainId(), message.srcAddr(), message.payload());
                delivered++;
                lastDeliveryAt = clock.instant();
            } catch (GmpException e) {
                if (!e.getCode().isDeliveredEquivalent()) {
                    return onFailure("deliver", message.nonce(), e);
                }
                log.info("Route {}: nonce {} already settled on chain {} ({})",
                    route.name(), message.nonce(), route.dstChainId(), e.getCode());
            } catch (RuntimeException e) {
                return onFailure("deliver", message.nonce(), e);
            }
            advance(message.nonce());
        }

        if (consecutiveFailures > 0) {
            log.info("Route {}: recovered after {} failed attempt(s)", route.name(), consecutiveFailures);
            consecutiveFailures = 0;
            lastError = null;
        }
        return batch.size() >= batchSize ? Duration.ZERO : pollInterval;
    }

    public synchronized RelayStatus status() {
        return new RelayStatus(route.name(), route.srcChainId(), route.dstChainId(), cursor,
            delivered, skipped, consecutiveFailures, lastError, lastDeliveryAt);
    }

    private void advance(long nonce) {
        cursor = nonce;
        cursors.save(route, nonce);
    }

    private Duration onFailure(String stage, long nonce, RuntimeException e) {
        consecutiveFailures++;
        lastError = e instanceof GmpException
            ? ((GmpException) e).getCode() + ": " + e.getMessage()
            : e.getMessage();
        Duration delay = backoff.delayFor(consecutiveFailures);
        log.warn("Route {}: {} failed at nonce {} (attempt {}), retrying in {} ms: {}",
            route.name(), stage, nonce, consecutiveFailures, delay.toMillis(), LogSanitizer.sanitize(lastError));
        return delay;
    }
}
