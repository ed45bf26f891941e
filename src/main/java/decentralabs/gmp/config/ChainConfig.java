package decentralabs.gmp.config;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.service.chain.ChainContext;
import decentralabs.gmp.service.chain.ChainRegistry;
import decentralabs.gmp.service.endpoint.EndpointRegistry;
import decentralabs.gmp.service.escrow.EscrowClaimVerifier;
import decentralabs.gmp.service.escrow.InflowEscrowService;
import decentralabs.gmp.service.hub.HubIntentService;
import decentralabs.gmp.service.outflow.OutflowValidatorService;
import decentralabs.gmp.util.Bytes32;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds one {@link ChainContext} per configured chain and wires its role services,
 * relays, trusted remotes and seed balances.
 */
@Configuration
@Slf4j
public class ChainConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChainRegistry chainRegistry(GmpProperties properties, Clock clock) {
        List<ChainContext> chains = new ArrayList<>();
        for (GmpProperties.Chain chainProperties : properties.getChains()) {
            chains.add(buildChain(chainProperties, clock));
        }
        return new ChainRegistry(chains);
    }

    public static ChainContext buildChain(GmpProperties.Chain props, Clock clock) {
        if (props.getAdmin() == null || props.getAdmin().isBlank()) {
            throw new IllegalStateException("gmp.chains[" + props.getId() + "].admin is required");
        }
        Bytes32 admin = Bytes32.fromHex(props.getAdmin());
        ChainContext chain = new ChainContext(props.getId(), admin, clock);
        EndpointRegistry endpoint = chain.getEndpoint();

        GmpProperties.Handlers handlers = props.getHandlers();
        if (isSet(handlers.getEscrow())) {
            InflowEscrowService escrow = new InflowEscrowService(chain, Bytes32.fromHex(handlers.getEscrow()),
                props.getReleaseMode(), new EscrowClaimVerifier(props.getApproverAddress()), props.getEscrowExpirySeconds());
            endpoint.bindHandler(admin, MessageType.INTENT_REQUIREMENTS, escrow);
            endpoint.bindHandler(admin, MessageType.FULFILLMENT_PROOF, escrow);
            chain.attach(escrow);
        }
        if (isSet(handlers.getOutflow())) {
            OutflowValidatorService outflow = new OutflowValidatorService(chain, Bytes32.fromHex(handlers.getOutflow()));
            endpoint.bindHandler(admin, MessageType.INTENT_REQUIREMENTS, outflow);
            chain.attach(outflow);
        }
        if (isSet(handlers.getHub())) {
            HubIntentService hub = new HubIntentService(chain, Bytes32.fromHex(handlers.getHub()));
            endpoint.bindHandler(admin, MessageType.ESCROW_CONFIRMATION, hub);
            endpoint.bindHandler(admin, MessageType.FULFILLMENT_PROOF, hub);
            chain.attach(hub);
        }
        for (MessageType type : props.getIgnoredTypes()) {
            endpoint.ignoreMessageType(admin, type);
        }

        for (String relay : props.getRelays()) {
            Bytes32 relayId = Bytes32.fromHex(relay);
            if (!endpoint.isRelayAuthorized(relayId)) {
                endpoint.addRelay(admin, relayId);
            }
        }
        for (Map.Entry<Long, List<String>> remote : props.getRemotes().entrySet()) {
            for (String addr : remote.getValue()) {
                endpoint.addRemoteEndpoint(admin, remote.getKey(), Bytes32.fromHex(addr));
            }
        }

        chain.atomically(() -> {
            for (GmpProperties.Balance balance : props.getBalances()) {
                chain.getTokens().mint(Bytes32.fromHex(balance.getToken()), Bytes32.fromHex(balance.getAccount()), balance.getAmount());
            }
        });

        log.info("Chain {} ready: escrow={}, outflow={}, hub={}, remotes={}",
            props.getId(), chain.findEscrow().isPresent(), chain.findOutflow().isPresent(),
            chain.findHub().isPresent(), props.getRemotes().keySet());
        return chain;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
