package decentralabs.gmp.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import decentralabs.gmp.dto.relay.RelayStatusResponse;
import decentralabs.gmp.service.relay.RelayService;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/relay")
@RequiredArgsConstructor
public class RelayStatusController {

    private final RelayService relayService;

    @GetMapping("/status")
    public ResponseEntity<RelayStatusResponse> status() {
        return ResponseEntity.ok(RelayStatusResponse.builder()
            .running(relayService.isRunning())
            .routes(relayService.status())
            .build());
    }
}
