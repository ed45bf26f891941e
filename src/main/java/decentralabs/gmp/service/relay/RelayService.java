package decentralabs.gmp.service.relay;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import decentralabs.gmp.config.GmpProperties;
import decentralabs.gmp.service.chain.ChainRegistry;
import decentralabs.gmp.util.Bytes32;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one {@link RelayWorker} per configured route. Each worker reschedules itself
 * with the delay its last batch returned, so a failing route backs off without
 * holding up the others.
 */
@Service
@Slf4j
public class RelayService {

    private final GmpProperties properties;
    private final List<RelayWorker> workers = new ArrayList<>();
    private final ScheduledExecutorService scheduler;

    private volatile boolean started = false;

    public RelayService(
        GmpProperties properties,
        ChainRegistry chains,
        RelayCursorRepository cursors,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.properties = properties;
        GmpProperties.Relay relay = properties.getRelay();
        List<GmpProperties.Route> routes = relay.getRoutes();
        if (!routes.isEmpty() && (relay.getIdentity() == null || relay.getIdentity().isBlank())) {
            throw new IllegalStateException("gmp.relay.identity is required when routes are configured");
        }
        BackoffPolicy backoff = new BackoffPolicy(relay.getInitialBackoff(), relay.getMaxBackoff());
        for (GmpProperties.Route configured : routes) {
            RelayRoute route = new RelayRoute(configured.getSource(), configured.getDestination());
            workers.add(new RelayWorker(
                route,
                sourceFor(route.srcChainId(), chains, relay, objectMapper),
                targetFor(route.dstChainId(), chains, relay, objectMapper),
                Bytes32.fromHex(relay.getIdentity()),
                cursors,
                backoff,
                relay.getPollInterval(),
                relay.getBatchSize(),
                clock
            ));
        }
        AtomicInteger threadIndex = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, workers.size()), r -> {
            Thread t = new Thread(r, "gmp-relay-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getRelay().isEnabled()) {
            start();
        } else {
            log.info("Relay is disabled");
        }
    }

    public synchronized void start() {
        if (started) {
            log.warn("Relay already started");
            return;
        }
        started = true;
        for (RelayWorker worker : workers) {
            scheduler.schedule(() -> tick(worker), 0, TimeUnit.MILLISECONDS);
        }
        log.info("Relay started with {} route(s), poll interval {} ms",
            workers.size(), properties.getRelay().getPollInterval().toMillis());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        scheduler.shutdownNow();
        log.info("Relay stopped");
    }

    public boolean isRunning() {
        return started;
    }

    public List<RelayStatus> status() {
        List<RelayStatus> result = new ArrayList<>();
        for (RelayWorker worker : workers) {
            result.add(worker.status());
        }
        return result;
    }

    private void tick(RelayWorker worker) {
        if (!started) {
            return;
        }
        Duration next;
        try {
            next = worker.runOnce();
        } catch (RuntimeException e) {
            log.error("Route {}: unexpected relay error: {}", worker.getRoute().name(), e.getMessage(), e);
            next = properties.getRelay().getMaxBackoff();
        }
        if (started) {
            scheduler.schedule(() -> tick(worker), next.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private static MailboxSource sourceFor(long chainId, ChainRegistry chains, GmpProperties.Relay relay, ObjectMapper mapper) {
        return chains.find(chainId)
            .<MailboxSource>map(LocalChainClient::new)
            .orElseGet(() -> remoteClient(chainId, relay, mapper));
    }

    private static DeliveryTarget targetFor(long chainId, ChainRegistry chains, GmpProperties.Relay relay, ObjectMapper mapper) {
        return chains.find(chainId)
            .<DeliveryTarget>map(LocalChainClient::new)
            .orElseGet(() -> remoteClient(chainId, relay, mapper));
    }

    private static HttpChainClient remoteClient(long chainId, GmpProperties.Relay relay, ObjectMapper mapper) {
        Map<Long, String> urls = relay.getRemoteUrls();
        String url = urls.get(chainId);
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("Chain " + chainId + " is neither hosted here nor listed in gmp.relay.remote-urls");
        }
        return new HttpChainClient(chainId, url, relay.getHttpTimeout(), mapper);
    }
}
