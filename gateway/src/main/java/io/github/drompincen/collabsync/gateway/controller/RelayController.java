package io.github.drompincen.collabsync.gateway.controller;

import io.github.drompincen.collabsync.gateway.websocket.RelaySessionSummary;
import io.github.drompincen.collabsync.gateway.websocket.RelayWebSocketHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/relay/sessions")
public class RelayController {

    private final RelayWebSocketHandler relay;

    public RelayController(RelayWebSocketHandler relay) {
        this.relay = relay;
    }

    @GetMapping
    public List<RelaySessionSummary> list() {
        return relay.sessions();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return relay.session(id)
                .map(s -> ResponseEntity.ok(s))
                .orElse(ResponseEntity.notFound().build());
    }
}
