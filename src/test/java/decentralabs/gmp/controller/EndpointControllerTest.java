package decentralabs.gmp.controller;

import static decentralabs.gmp.support.TestAddresses.addr;
import static decentralabs.gmp.support.TestAddresses.intent;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.web3j.utils.Numeric;

import com.fasterxml.jackson.databind.ObjectMapper;
import decentralabs.gmp.dto.endpoint.DeliverRequest;
import decentralabs.gmp.dto.endpoint.RelayChangeRequest;
import decentralabs.gmp.dto.endpoint.RemoteEndpointRequest;
import decentralabs.gmp.dto.message.IntentRequirements;
import decentralabs.gmp.exception.GlobalExceptionHandler;
import decentralabs.gmp.service.chain.ChainRegistry;
import decentralabs.gmp.service.codec.MessageCodec;
import decentralabs.gmp.support.MutableClock;
import decentralabs.gmp.support.TestChains;
import decentralabs.gmp.util.Bytes32;

@DisplayName("EndpointController Tests")
class EndpointControllerTest {

    private static final long START = 1_700_000_000L;

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;
    private ChainRegistry chains;

    @BeforeEach
    void setUp() {
        chains = TestChains.hubAndConnected(new MutableClock(START));
        mockMvc = MockMvcBuilders.standaloneSetup(new EndpointController(chains))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
        objectMapper = new ObjectMapper();
    }

    private String requirementsPayload(int n) {
        return Numeric.toHexString(MessageCodec.encode(new IntentRequirements(intent(n), addr(0xA1), 100,
            Bytes32.fromHex(TestChains.TOKEN), Bytes32.ZERO, START + 60)));
    }

    private String deliverBody(String srcAddr, String payload) throws Exception {
        return objectMapper.writeValueAsString(new DeliverRequest(1L, srcAddr, payload));
    }

    @Nested
    @DisplayName("Deliver Endpoint Tests")
    class DeliverTests {

        @Test
        @DisplayName("Should deliver a message from an authorized relay")
        void shouldDeliver() throws Exception {
            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(deliverBody(TestChains.HUB_HANDLER, requirementsPayload(1))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.messageType").value("intent_requirements"))
                .andExpect(jsonPath("$.intentId").value(intent(1).toHex()))
                .andExpect(jsonPath("$.handlerCount").value(2));
        }

        @Test
        @DisplayName("Should answer a replay with ALREADY_DELIVERED")
        void shouldRejectReplay() throws Exception {
            String body = deliverBody(TestChains.HUB_HANDLER, requirementsPayload(2));
            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
                .andExpect(status().isOk());

            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("ALREADY_DELIVERED"));
        }

        @Test
        @DisplayName("Should reject an unknown relay")
        void shouldRejectUnknownRelay() throws Exception {
            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, "0xbeef")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(deliverBody(TestChains.HUB_HANDLER, requirementsPayload(3))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED_RELAY"));
        }

        @Test
        @DisplayName("Should reject an untrusted source address")
        void shouldRejectUntrustedSource() throws Exception {
            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(deliverBody("0x10002", requirementsPayload(4))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("UNREGISTERED_REMOTE_ENDPOINT"));
        }

        @Test
        @DisplayName("Should reject a payload of the wrong length")
        void shouldRejectTruncatedPayload() throws Exception {
            String truncated = requirementsPayload(5).substring(0, 2 + 2 * 100);
            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(deliverBody(TestChains.HUB_HANDLER, truncated)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_LENGTH"));
        }

        @Test
        @DisplayName("Should validate the request body")
        void shouldValidateBody() throws Exception {
            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(deliverBody("not-hex", "0x01")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors.srcAddr").exists());
        }

        @Test
        @DisplayName("Should report unknown chains")
        void shouldRejectUnknownChain() throws Exception {
            mockMvc.perform(post("/chains/9/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(deliverBody(TestChains.HUB_HANDLER, requirementsPayload(6))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_CHAIN"));
        }
    }

    @Nested
    @DisplayName("Outbound Endpoint Tests")
    class OutboundTests {

        @Test
        @DisplayName("Should list committed entries after a nonce")
        void shouldListOutbound() throws Exception {
            chains.require(2).escrow().create(addr(0xA1), intent(1), 10, Bytes32.fromHex(TestChains.TOKEN), Bytes32.fromHex(TestChains.SOLVER), null);
            mockMvc.perform(post("/chains/2/deliver")
                    .header(CallerHeaders.RELAY, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(deliverBody(TestChains.HUB_HANDLER, requirementsPayload(7))))
                .andExpect(status().isOk());
            chains.require(2).escrow().create(addr(0xA1), intent(7), 100, Bytes32.fromHex(TestChains.TOKEN), Bytes32.fromHex(TestChains.SOLVER), null);

            mockMvc.perform(get("/chains/2/outbound").param("afterNonce", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.latestNonce").value(1))
                .andExpect(jsonPath("$.messages", hasSize(1)))
                .andExpect(jsonPath("$.messages[0].nonce").value(1))
                .andExpect(jsonPath("$.messages[0].dstChainId").value(1))
                .andExpect(jsonPath("$.messages[0].messageType").value("escrow_confirmation"));

            mockMvc.perform(get("/chains/2/outbound").param("afterNonce", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages", hasSize(0)));
        }

        @Test
        @DisplayName("Should reject an oversized page")
        void shouldRejectLargeLimit() throws Exception {
            mockMvc.perform(get("/chains/2/outbound").param("limit", "501"))
                .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Administration Endpoint Tests")
    class AdministrationTests {

        @Test
        @DisplayName("Should describe the endpoint configuration")
        void shouldReturnInfo() throws Exception {
            mockMvc.perform(get("/chains/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chainId").value(2))
                .andExpect(jsonPath("$.handlers.intent_requirements", hasSize(2)))
                .andExpect(jsonPath("$.handlers.fulfillment_proof", hasSize(1)))
                .andExpect(jsonPath("$.remotes['1']", hasSize(1)))
                .andExpect(jsonPath("$.relays", hasSize(2)));
        }

        @Test
        @DisplayName("Should let the admin add and remove relays")
        void shouldManageRelays() throws Exception {
            mockMvc.perform(post("/chains/2/relays")
                    .header(CallerHeaders.CALLER, TestChains.CONNECTED_ADMIN)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new RelayChangeRequest("0xbeef"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

            mockMvc.perform(delete("/chains/2/relays/0xbeef")
                    .header(CallerHeaders.CALLER, TestChains.CONNECTED_ADMIN))
                .andExpect(status().isOk());

            mockMvc.perform(delete("/chains/2/relays/0xbeef")
                    .header(CallerHeaders.CALLER, TestChains.CONNECTED_ADMIN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Should refuse administration from anyone but the admin")
        void shouldRequireAdmin() throws Exception {
            mockMvc.perform(post("/chains/2/relays")
                    .header(CallerHeaders.CALLER, TestChains.RELAY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new RelayChangeRequest("0xbeef"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED_ADMIN"));
        }

        @Test
        @DisplayName("Should replace or extend the trusted remotes")
        void shouldSetRemoteEndpoints() throws Exception {
            mockMvc.perform(put("/chains/2/remotes/3")
                    .header(CallerHeaders.CALLER, TestChains.CONNECTED_ADMIN)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new RemoteEndpointRequest("0x30001", false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.addresses", hasSize(1)));

            mockMvc.perform(put("/chains/2/remotes/3")
                    .header(CallerHeaders.CALLER, TestChains.CONNECTED_ADMIN)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new RemoteEndpointRequest("0x30002", true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.addresses", hasSize(2)));
        }

        @Test
        @DisplayName("Should report token balances")
        void shouldReturnBalance() throws Exception {
            mockMvc.perform(get("/chains/2/balances/" + TestChains.TOKEN + "/" + TestChains.SOLVER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value("10000"));
        }
    }
}
