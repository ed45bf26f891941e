package decentralabs.gmp.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import decentralabs.gmp.dto.hub.CreateHubIntentRequest;
import decentralabs.gmp.dto.hub.HubIntentResponse;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.chain.ChainRegistry;
import decentralabs.gmp.service.hub.HubIntentRecord;
import decentralabs.gmp.service.hub.HubIntentRequest;
import decentralabs.gmp.service.hub.HubIntentService;
import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.Uint64;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/chains/{chainId}/hub/intents")
@RequiredArgsConstructor
public class HubIntentController {

    private final ChainRegistry chains;

    @PostMapping("/outflow")
    public ResponseEntity<HubIntentResponse> createOutflow(
        @PathVariable long chainId,
        @RequestHeader(CallerHeaders.CALLER) String caller,
        @RequestBody @Valid CreateHubIntentRequest request
    ) {
        HubIntentRecord record = hub(chainId).createOutflowIntent(Bytes32.fromHex(caller), toRequest(request));
        return ResponseEntity.ok(HubIntentResponse.from(chainId, record));
    }

    @PostMapping("/inflow")
    public ResponseEntity<HubIntentResponse> createInflow(
        @PathVariable long chainId,
        @RequestHeader(CallerHeaders.CALLER) String caller,
        @RequestBody @Valid CreateHubIntentRequest request
    ) {
        HubIntentRecord record = hub(chainId).createInflowIntent(Bytes32.fromHex(caller), toRequest(request));
        return ResponseEntity.ok(HubIntentResponse.from(chainId, record));
    }

    @PostMapping("/{intentId}/fulfill")
    public ResponseEntity<HubIntentResponse> fulfill(
        @PathVariable long chainId,
        @PathVariable String intentId,
        @RequestHeader(CallerHeaders.CALLER) String caller
    ) {
        HubIntentRecord record = hub(chainId).fulfillInflowIntent(Bytes32.fromHex(caller), Bytes32.fromHex(intentId));
        return ResponseEntity.ok(HubIntentResponse.from(chainId, record));
    }

    @PostMapping("/{intentId}/cancel")
    public ResponseEntity<HubIntentResponse> cancel(
        @PathVariable long chainId,
        @PathVariable String intentId,
        @RequestHeader(CallerHeaders.CALLER) String caller
    ) {
        HubIntentRecord record = hub(chainId).cancelIntent(Bytes32.fromHex(caller), Bytes32.fromHex(intentId));
        return ResponseEntity.ok(HubIntentResponse.from(chainId, record));
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<HubIntentResponse> get(@PathVariable long chainId, @PathVariable String intentId) {
        Bytes32 id = Bytes32.fromHex(intentId);
        HubIntentRecord record = hub(chainId).find(id)
            .orElseThrow(() -> new GmpException(GmpErrorCode.DOES_NOT_EXIST, "No hub intent " + id));
        return ResponseEntity.ok(HubIntentResponse.from(chainId, record));
    }

    private HubIntentService hub(long chainId) {
        return chains.require(chainId).hub();
    }

    private static HubIntentRequest toRequest(CreateHubIntentRequest request) {
        return new HubIntentRequest(
            Bytes32.fromHex(request.getIntentId()),
            request.getConnectedChainId(),
            Bytes32.fromHex(request.getConnectedHandler()),
            optional(request.getConnectedRequester()),
            Bytes32.fromHex(request.getHubToken()),
            Uint64.parse(request.getHubAmount(), "hubAmount"),
            Bytes32.fromHex(request.getConnectedToken()),
            Uint64.parse(request.getConnectedAmount(), "connectedAmount"),
            optional(request.getSolver()),
            request.getExpiry()
        );
    }

    private static Bytes32 optional(String hex) {
        return hex == null || hex.isBlank() ? Bytes32.ZERO : Bytes32.fromHex(hex);
    }
}
