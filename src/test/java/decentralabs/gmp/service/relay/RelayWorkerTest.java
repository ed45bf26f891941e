package decentralabs.gmp.service.relay;

import static decentralabs.gmp.support.TestAddresses.addr;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.endpoint.OutboundMessage;
import decentralabs.gmp.util.Bytes32;

@ExtendWith(MockitoExtension.class)
@DisplayName("RelayWorker Tests")
class RelayWorkerTest {

    private static final RelayRoute ROUTE = new RelayRoute(1, 2);
    private static final Bytes32 RELAY = addr(0xE1A70);
    private static final Bytes32 SENDER = addr(0x10001);
    private static final Duration POLL = Duration.ofSeconds(2);
    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    @Mock
    private MailboxSource source;

    @Mock
    private DeliveryTarget target;

    @Mock
    private RelayCursorRepository cursors;

    private RelayWorker worker;

    @BeforeEach
    void setUp() {
        when(cursors.load(ROUTE)).thenReturn(0L);
        worker = newWorker(10);
    }

    private RelayWorker newWorker(int batchSize) {
        return new RelayWorker(ROUTE, source, target, RELAY, cursors,
            new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8)), POLL, batchSize,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OutboundMessage message(long nonce, long dstChainId) {
        return new OutboundMessage(nonce, 1, SENDER, dstChainId, addr(0x20001), new byte[] { (byte) nonce }, NOW);
    }

    @Test
    @DisplayName("Should deliver entries in nonce order and advance the cursor")
    void shouldDeliverInOrder() {
        OutboundMessage first = message(1, 2);
        OutboundMessage second = message(2, 2);
        when(source.fetchOutbound(0, 10)).thenReturn(List.of(first, second));

        Duration next = worker.runOnce();

        assertThat(next).isEqualTo(POLL);
        InOrder order = inOrder(target, cursors);
        order.verify(target).deliver(RELAY, 1, SENDER, first.payload());
        order.verify(cursors).save(ROUTE, 1);
        order.verify(target).deliver(RELAY, 1, SENDER, second.payload());
        order.verify(cursors).save(ROUTE, 2);

        RelayStatus status = worker.status();
        assertThat(status.cursor()).isEqualTo(2);
        assertThat(status.delivered()).isEqualTo(2);
        assertThat(status.lastDeliveryAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should poll again immediately when the batch was full")
    void shouldContinueAfterFullBatch() {
        worker = newWorker(2);
        when(source.fetchOutbound(0, 2)).thenReturn(List.of(message(1, 2), message(2, 2)));

        assertThat(worker.runOnce()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Should wait the poll interval when idle")
    void shouldIdleWhenEmpty() {
        when(source.fetchOutbound(0, 10)).thenReturn(List.of());

        assertThat(worker.runOnce()).isEqualTo(POLL);
        verify(cursors, never()).save(any(), anyLong());
    }

    @Test
    @DisplayName("Should skip entries addressed to other chains")
    void shouldSkipOtherDestinations() {
        OutboundMessage elsewhere = message(1, 3);
        OutboundMessage ours = message(2, 2);
        when(source.fetchOutbound(0, 10)).thenReturn(List.of(elsewhere, ours));

        worker.runOnce();

        verify(target, never()).deliver(RELAY, 1, SENDER, elsewhere.payload());
        verify(target).deliver(RELAY, 1, SENDER, ours.payload());
        assertThat(worker.status().skipped()).isEqualTo(1);
        assertThat(worker.status().cursor()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should treat an already delivered message as done")
    void shouldAdvancePastAlreadyDelivered() {
        OutboundMessage first = message(1, 2);
        when(source.fetchOutbound(0, 10)).thenReturn(List.of(first));
        when(target.deliver(RELAY, 1, SENDER, first.payload()))
            .thenThrow(new GmpException(GmpErrorCode.ALREADY_DELIVERED, "duplicate"));

        assertThat(worker.runOnce()).isEqualTo(POLL);

        verify(cursors).save(ROUTE, 1);
        assertThat(worker.status().consecutiveFailures()).isZero();
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should stop at a failed entry and retry it before anything behind it")
        void shouldRetryFailedEntryFirst() {
            OutboundMessage first = message(1, 2);
            OutboundMessage second = message(2, 2);
            OutboundMessage third = message(3, 2);
            when(source.fetchOutbound(0, 10)).thenReturn(List.of(first, second, third));
            when(target.deliver(eq(RELAY), eq(1L), eq(SENDER), any()))
                .thenReturn(null)
                .thenThrow(new GmpException(GmpErrorCode.UNAUTHORIZED_RELAY, "not a relay"))
                .thenReturn(null);

            assertThat(worker.runOnce()).isEqualTo(Duration.ofSeconds(1));
            verify(target, never()).deliver(RELAY, 1, SENDER, third.payload());
            assertThat(worker.status().cursor()).isEqualTo(1);
            assertThat(worker.status().lastError()).startsWith("UNAUTHORIZED_RELAY");

            when(source.fetchOutbound(1, 10)).thenReturn(List.of(second, third));
            assertThat(worker.runOnce()).isEqualTo(POLL);

            assertThat(worker.status().cursor()).isEqualTo(3);
            assertThat(worker.status().consecutiveFailures()).isZero();
            assertThat(worker.status().lastError()).isNull();
        }

        @Test
        @DisplayName("Should back off exponentially while the source is unreachable")
        void shouldBackOffOnReadFailures() {
            when(source.fetchOutbound(anyLong(), anyInt())).thenThrow(new RelayTransportException("connection refused"));

            assertThat(worker.runOnce()).isEqualTo(Duration.ofSeconds(1));
            assertThat(worker.runOnce()).isEqualTo(Duration.ofSeconds(2));
            assertThat(worker.runOnce()).isEqualTo(Duration.ofSeconds(4));
            assertThat(worker.runOnce()).isEqualTo(Duration.ofSeconds(8));
            assertThat(worker.runOnce()).isEqualTo(Duration.ofSeconds(8));
            assertThat(worker.status().consecutiveFailures()).isEqualTo(5);
            verify(cursors, never()).save(any(), anyLong());
        }

        @Test
        @DisplayName("Should not advance past a transport failure")
        void shouldKeepCursorOnTransportFailure() {
            OutboundMessage first = message(1, 2);
            when(source.fetchOutbound(0, 10)).thenReturn(List.of(first));
            when(target.deliver(eq(RELAY), eq(1L), eq(SENDER), any()))
                .thenThrow(new RelayTransportException("timeout"));

            worker.runOnce();
            worker.runOnce();

            assertThat(worker.status().cursor()).isZero();
            assertThat(worker.status().consecutiveFailures()).isEqualTo(2);
            verify(cursors, never()).save(any(), anyLong());
        }
    }

    @Test
    @DisplayName("Should resume from the persisted cursor")
    void shouldResumeFromPersistedCursor() {
        RelayRoute route = new RelayRoute(2, 1);
        when(cursors.load(route)).thenReturn(41L);
        when(source.fetchOutbound(41, 10)).thenReturn(List.of());

        RelayWorker resumed = new RelayWorker(route, source, target, RELAY, cursors,
            new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8)), POLL, 10, Clock.systemUTC());
        resumed.runOnce();

        assertThat(resumed.status().cursor()).isEqualTo(41);
    }
}
