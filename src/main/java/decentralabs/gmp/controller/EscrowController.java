package decentralabs.gmp.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import decentralabs.gmp.dto.escrow.ClaimEscrowRequest;
import decentralabs.gmp.dto.escrow.CreateEscrowRequest;
import decentralabs.gmp.dto.escrow.EscrowResponse;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.chain.ChainRegistry;
import decentralabs.gmp.service.escrow.EscrowRecord;
import decentralabs.gmp.service.escrow.InflowEscrowService;
import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.Uint64;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/chains/{chainId}/escrows")
@RequiredArgsConstructor
public class EscrowController {

    private final ChainRegistry chains;

    @PostMapping
    public ResponseEntity<EscrowResponse> create(
        @PathVariable long chainId,
        @RequestHeader(CallerHeaders.CALLER) String caller,
        @RequestBody @Valid CreateEscrowRequest request
    ) {
        InflowEscrowService escrow = chains.require(chainId).escrow();
        EscrowRecord record = escrow.create(
            Bytes32.fromHex(caller),
            Bytes32.fromHex(request.getIntentId()),
            Uint64.parse(request.getAmount(), "amount"),
            Bytes32.fromHex(request.getToken()),
            request.getSolver() != null && !request.getSolver().isBlank() ? Bytes32.fromHex(request.getSolver()) : Bytes32.ZERO,
            request.getExpirySeconds()
        );
        return ResponseEntity.ok(EscrowResponse.from(chainId, record));
    }

    @PostMapping("/{intentId}/cancel")
    public ResponseEntity<EscrowResponse> cancel(
        @PathVariable long chainId,
        @PathVariable String intentId,
        @RequestHeader(CallerHeaders.CALLER) String caller
    ) {
        EscrowRecord record = chains.require(chainId).escrow().cancel(Bytes32.fromHex(caller), Bytes32.fromHex(intentId));
        return ResponseEntity.ok(EscrowResponse.from(chainId, record));
    }

    @PostMapping("/{intentId}/claim")
    public ResponseEntity<EscrowResponse> claim(
        @PathVariable long chainId,
        @PathVariable String intentId,
        @RequestBody @Valid ClaimEscrowRequest request
    ) {
        EscrowRecord record = chains.require(chainId).escrow().claim(Bytes32.fromHex(intentId), request.getSignature());
        return ResponseEntity.ok(EscrowResponse.from(chainId, record));
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<EscrowResponse> get(@PathVariable long chainId, @PathVariable String intentId) {
        Bytes32 id = Bytes32.fromHex(intentId);
        EscrowRecord record = chains.require(chainId).escrow().find(id)
            .orElseThrow(() -> new GmpException(GmpErrorCode.DOES_NOT_EXIST, "No escrow for intent " + id));
        return ResponseEntity.ok(EscrowResponse.from(chainId, record));
    }
}
