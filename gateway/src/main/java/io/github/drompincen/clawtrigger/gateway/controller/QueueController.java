package io.github.drompincen.clawtrigger.gateway.controller;

import io.github.drompincen.clawtrigger.protocol.api.QueueStats;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.queue.QueuedJob;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/queue")
public class QueueController {

    private final ExecutionQueue queue;

    public QueueController(ExecutionQueue queue) {
        this.queue = queue;
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return queue.stats();
    }

    @GetMapping("/dead-letters")
    public List<QueuedJob> deadLetters() {
        return queue.listDeadLetters();
    }

    @PostMapping("/dead-letters/{jobId}/requeue")
    public ResponseEntity<Map<String, Object>> requeue(@PathVariable String jobId) {
        if (!queue.requeueDeadLetter(jobId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("jobId", jobId, "requeued", true));
    }

    @DeleteMapping("/dead-letters")
    public Map<String, Object> purge() {
        return Map.of("purged", queue.purgeDeadLetters());
    }
}
