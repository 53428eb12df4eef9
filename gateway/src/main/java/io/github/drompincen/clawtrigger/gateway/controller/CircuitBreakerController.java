package io.github.drompincen.clawtrigger.gateway.controller;

import io.github.drompincen.clawtrigger.protocol.api.CircuitBreakerStatus;
import io.github.drompincen.clawtrigger.runtime.breaker.CircuitBreakerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/circuit-breakers")
public class CircuitBreakerController {

    private final CircuitBreakerRegistry breakers;

    public CircuitBreakerController(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @GetMapping
    public Map<String, CircuitBreakerStatus> status() {
        return breakers.getCircuitBreakerStatus();
    }

    @GetMapping("/{name}")
    public ResponseEntity<CircuitBreakerStatus> get(@PathVariable String name) {
        return breakers.get(name)
                .map(b -> ResponseEntity.ok(b.status()))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/reset")
    public ResponseEntity<Map<String, Object>> reset(@PathVariable String name) {
        if (!breakers.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("name", name, "reset", true));
    }

    @PostMapping("/reset")
    public Map<String, Object> resetAll() {
        breakers.resetAll();
        return Map.of("reset", true);
    }
}
