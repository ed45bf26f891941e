package decentralabs.gmp.service.relay;

import java.time.Instant;

/**
 * Point-in-time view of one relay worker.
 */
public record RelayStatus(
    String route,
    long srcChainId,
    long dstChainId,
    long cursor,
    long delivered,
    long skipped,
    int consecutiveFailures,
    String lastError,
    Instant lastDeliveryAt
) {
}
