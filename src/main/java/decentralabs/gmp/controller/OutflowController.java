package decentralabs.gmp.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import decentralabs.gmp.dto.outflow.FulfillOutflowRequest;
import decentralabs.gmp.dto.outflow.OutflowResponse;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.chain.ChainRegistry;
import decentralabs.gmp.service.outflow.OutflowRequirements;
import decentralabs.gmp.service.outflow.OutflowValidatorService;
import decentralabs.gmp.util.Bytes32;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/chains/{chainId}/outflow")
@RequiredArgsConstructor
public class OutflowController {

    private final ChainRegistry chains;

    @PostMapping("/{intentId}/fulfill")
    public ResponseEntity<OutflowResponse> fulfill(
        @PathVariable long chainId,
        @PathVariable String intentId,
        @RequestHeader(CallerHeaders.CALLER) String caller,
        @RequestBody @Valid FulfillOutflowRequest request
    ) {
        OutflowValidatorService outflow = chains.require(chainId).outflow();
        Bytes32 id = Bytes32.fromHex(intentId);
        long nonce = outflow.fulfillIntent(Bytes32.fromHex(caller), id, Bytes32.fromHex(request.getToken()));
        return ResponseEntity.ok(OutflowResponse.from(chainId, require(outflow, id), nonce));
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<OutflowResponse> get(@PathVariable long chainId, @PathVariable String intentId) {
        OutflowValidatorService outflow = chains.require(chainId).outflow();
        return ResponseEntity.ok(OutflowResponse.from(chainId, require(outflow, Bytes32.fromHex(intentId)), null));
    }

    private static OutflowRequirements require(OutflowValidatorService outflow, Bytes32 intentId) {
        return outflow.find(intentId).orElseThrow(() ->
            new GmpException(GmpErrorCode.REQUIREMENTS_NOT_FOUND, "No requirements for intent " + intentId));
    }
}
