package decentralabs.gmp.config;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.service.escrow.EscrowReleaseMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "gmp")
public class GmpProperties {

    /** Logical chains hosted by this process. */
    private List<Chain> chains = new ArrayList<>();

    private Relay relay = new Relay();

    @Data
    public static class Chain {

        /** Unsigned 32-bit chain id. */
        private long id;

        /** Endpoint admin, 32-byte hex. Also the first authorized relay. */
        private String admin;

        /** Local handler addresses; a role is hosted when its address is set. */
        private Handlers handlers = new Handlers();

        private EscrowReleaseMode releaseMode = EscrowReleaseMode.GMP;

        /** 20-byte address whose signature releases escrows in SIGNATURE mode. */
        private String approverAddress;

        /** Escrow expiry used when a create call omits one. */
        private long escrowExpirySeconds = 120;

        /** Relays authorized in addition to the admin. */
        private List<String> relays = new ArrayList<>();

        /** Trusted sender addresses per source chain id. */
        private Map<Long, List<String>> remotes = new LinkedHashMap<>();

        /** Message types accepted without a bound handler. */
        private List<MessageType> ignoredTypes = new ArrayList<>();

        /** Balances credited at startup. */
        private List<Balance> balances = new ArrayList<>();
    }

    @Data
    public static class Handlers {
        private String escrow;
        private String outflow;
        private String hub;
    }

    @Data
    public static class Balance {
        private String token;
        private String account;
        private BigInteger amount = BigInteger.ZERO;
    }

    @Data
    public static class Relay {

        private boolean enabled = true;

        /** Identity presented to destination endpoints, 32-byte hex. */
        private String identity;

        private Duration pollInterval = Duration.ofSeconds(2);

        private int batchSize = 50;

        private Duration initialBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofSeconds(60);

        private Duration httpTimeout = Duration.ofSeconds(10);

        /** Directed (source, destination) pairs, one worker each. */
        private List<Route> routes = new ArrayList<>();

        /** Base URLs of chains not hosted in this process, by chain id. */
        private Map<Long, String> remoteUrls = new LinkedHashMap<>();
    }

    @Data
    public static class Route {
        private long source;
        private long destination;
    }
}
