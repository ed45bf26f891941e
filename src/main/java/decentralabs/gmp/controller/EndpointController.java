package decentralabs.gmp.controller;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import decentralabs.gmp.dto.endpoint.DeliverRequest;
import decentralabs.gmp.dto.endpoint.DeliverResponse;
import decentralabs.gmp.dto.endpoint.EndpointInfoResponse;
import decentralabs.gmp.dto.endpoint.OutboundBatchResponse;
import decentralabs.gmp.dto.endpoint.OutboundMessageResponse;
import decentralabs.gmp.dto.endpoint.RelayChangeRequest;
import decentralabs.gmp.dto.endpoint.RemoteEndpointRequest;
import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.service.chain.ChainContext;
import decentralabs.gmp.service.chain.ChainRegistry;
import decentralabs.gmp.service.endpoint.DeliveryReceipt;
import decentralabs.gmp.service.endpoint.EndpointRegistry;
import decentralabs.gmp.service.endpoint.MessageHandler;
import decentralabs.gmp.service.endpoint.OutboundMailbox;
import decentralabs.gmp.service.endpoint.OutboundMessage;
import decentralabs.gmp.util.Bytes32;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/chains/{chainId}")
@RequiredArgsConstructor
public class EndpointController {

    private static final int MAX_BATCH = 500;

    private final ChainRegistry chains;

    @PostMapping("/deliver")
    public ResponseEntity<DeliverResponse> deliver(
        @PathVariable long chainId,
        @RequestHeader(CallerHeaders.RELAY) String relayId,
        @RequestBody @Valid DeliverRequest request
    ) {
        ChainContext chain = chains.require(chainId);
        DeliveryReceipt receipt = chain.getEndpoint().deliver(
            Bytes32.fromHex(relayId),
            request.getSrcChainId(),
            Bytes32.fromHex(request.getSrcAddr()),
            Numeric.hexStringToByteArray(request.getPayload())
        );
        return ResponseEntity.ok(DeliverResponse.from(receipt));
    }

    @GetMapping("/outbound")
    public ResponseEntity<OutboundBatchResponse> outbound(
        @PathVariable long chainId,
        @RequestParam(defaultValue = "0") long afterNonce,
        @RequestParam(defaultValue = "100") int limit
    ) {
        if (limit <= 0 || limit > MAX_BATCH) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_BATCH);
        }
        OutboundMailbox mailbox = chains.require(chainId).getMailbox();
        List<OutboundMessageResponse> messages = new ArrayList<>();
        for (OutboundMessage message : mailbox.entriesAfter(afterNonce, limit)) {
            messages.add(OutboundMessageResponse.from(message));
        }
        return ResponseEntity.ok(OutboundBatchResponse.builder()
            .success(true)
            .chainId(chainId)
            .latestNonce(mailbox.latestNonce())
            .messages(messages)
            .build());
    }

    @GetMapping
    public ResponseEntity<EndpointInfoResponse> info(@PathVariable long chainId) {
        ChainContext chain = chains.require(chainId);
        EndpointRegistry endpoint = chain.getEndpoint();

        Map<Long, List<String>> remotes = new LinkedHashMap<>();
        for (Long srcChainId : endpoint.getRemoteChainIds()) {
            remotes.put(srcChainId, endpoint.getRemoteEndpoints(srcChainId).stream().map(Bytes32::toHex).sorted().toList());
        }
        Map<String, List<String>> handlers = new LinkedHashMap<>();
        for (MessageType type : MessageType.values()) {
            List<MessageHandler> bound = endpoint.handlersFor(type);
            if (!bound.isEmpty()) {
                handlers.put(type.getWireValue(), bound.stream().map(h -> h.address().toHex()).toList());
            }
        }
        return ResponseEntity.ok(EndpointInfoResponse.builder()
            .chainId(chainId)
            .admin(endpoint.getAdmin().toHex())
            .relays(endpoint.getRelays().stream().map(Bytes32::toHex).sorted().toList())
            .remotes(remotes)
            .handlers(handlers)
            .ignoredTypes(endpoint.getIgnoredTypes().stream().map(MessageType::getWireValue).toList())
            .latestNonce(chain.getMailbox().latestNonce())
            .deliveredCount(chain.getDeliveryLedger().size())
            .build());
    }

    @PostMapping("/relays")
    public ResponseEntity<Map<String, Object>> addRelay(
        @PathVariable long chainId,
        @RequestHeader(CallerHeaders.CALLER) String caller,
        @RequestBody @Valid RelayChangeRequest request
    ) {
        chains.require(chainId).getEndpoint().addRelay(Bytes32.fromHex(caller), Bytes32.fromHex(request.getRelay()));
        return ResponseEntity.ok(Map.of("success", true, "relay", Bytes32.fromHex(request.getRelay()).toHex()));
    }

    @DeleteMapping("/relays/{relay}")
    public ResponseEntity<Map<String, Object>> removeRelay(
        @PathVariable long chainId,
        @PathVariable String relay,
        @RequestHeader(CallerHeaders.CALLER) String caller
    ) {
        chains.require(chainId).getEndpoint().removeRelay(Bytes32.fromHex(caller), Bytes32.fromHex(relay));
        return ResponseEntity.ok(Map.of("success", true, "relay", Bytes32.fromHex(relay).toHex()));
    }

    @PutMapping("/remotes/{srcChainId}")
    public ResponseEntity<Map<String, Object>> setRemoteEndpoint(
        @PathVariable long chainId,
        @PathVariable long srcChainId,
        @RequestHeader(CallerHeaders.CALLER) String caller,
        @RequestBody @Valid RemoteEndpointRequest request
    ) {
        EndpointRegistry endpoint = chains.require(chainId).getEndpoint();
        Bytes32 addr = Bytes32.fromHex(request.getAddress());
        if (request.isAppend()) {
            endpoint.addRemoteEndpoint(Bytes32.fromHex(caller), srcChainId, addr);
        } else {
            endpoint.setRemoteEndpoint(Bytes32.fromHex(caller), srcChainId, addr);
        }
        List<String> trusted = endpoint.getRemoteEndpoints(srcChainId).stream().map(Bytes32::toHex).sorted().toList();
        return ResponseEntity.ok(Map.of("success", true, "srcChainId", srcChainId, "addresses", trusted));
    }

    @GetMapping("/balances/{token}/{account}")
    public ResponseEntity<Map<String, Object>> balance(
        @PathVariable long chainId,
        @PathVariable String token,
        @PathVariable String account
    ) {
        ChainContext chain = chains.require(chainId);
        Bytes32 tokenAddr = Bytes32.fromHex(token);
        Bytes32 accountAddr = Bytes32.fromHex(account);
        return ResponseEntity.ok(Map.of(
            "token", tokenAddr.toHex(),
            "account", accountAddr.toHex(),
            "balance", chain.getTokens().balanceOf(tokenAddr, accountAddr).toString()
        ));
    }
}
