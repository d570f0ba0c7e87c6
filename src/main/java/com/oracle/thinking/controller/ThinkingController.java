package com.oracle.thinking.controller;

import com.oracle.thinking.model.BacktrackRequest;
import com.oracle.thinking.model.BacktrackResult;
import com.oracle.thinking.model.EngineStats;
import com.oracle.thinking.model.EvaluateRequest;
import com.oracle.thinking.model.EvaluationResult;
import com.oracle.thinking.model.HealthStatus;
import com.oracle.thinking.model.MetricsSnapshot;
import com.oracle.thinking.model.ModeRequest;
import com.oracle.thinking.model.Suggestion;
import com.oracle.thinking.model.ThinkingSummary;
import com.oracle.thinking.model.ThoughtRecord;
import com.oracle.thinking.model.ThoughtResponse;
import com.oracle.thinking.service.HealthCheckService;
import com.oracle.thinking.service.SequentialThinkingService;
import com.oracle.thinking.strategy.ThinkingModeConfig;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/thinking")
@RequiredArgsConstructor
@Slf4j
public class ThinkingController {

    private final SequentialThinkingService thinkingService;
    private final HealthCheckService healthCheckService;

    @PostMapping("/thoughts")
    public ResponseEntity<ThoughtResponse> submitThought(@RequestBody ThoughtRecord record) {
        log.debug("Received thought #{}", record.getThoughtNumber());
        return ResponseEntity.ok(thinkingService.submitThought(record));
    }

    @PostMapping("/sessions/{sessionId}/backtrack")
    public ResponseEntity<BacktrackResult> backtrack(@PathVariable String sessionId,
                                                     @Valid @RequestBody BacktrackRequest request) {
        return ResponseEntity.ok(thinkingService.backtrack(sessionId, request.getNodeId()));
    }

    @PostMapping("/sessions/{sessionId}/evaluate")
    public ResponseEntity<EvaluationResult> evaluate(@PathVariable String sessionId,
                                                     @Valid @RequestBody EvaluateRequest request) {
        return ResponseEntity.ok(thinkingService.evaluateNode(sessionId, request.getNodeId(), request.getValue()));
    }

    @GetMapping("/sessions/{sessionId}/suggestion")
    public ResponseEntity<Suggestion> suggest(@PathVariable String sessionId,
                                              @RequestParam(value = "strategy", required = false) String strategy) {
        return ResponseEntity.ok(thinkingService.suggestNext(sessionId, strategy));
    }

    @GetMapping("/sessions/{sessionId}/summary")
    public ResponseEntity<ThinkingSummary> summary(@PathVariable String sessionId,
                                                   @RequestParam(value = "maxDepth", required = false) Integer maxDepth) {
        return ResponseEntity.ok(thinkingService.getSummary(sessionId, maxDepth));
    }

    @PutMapping("/sessions/{sessionId}/mode")
    public ResponseEntity<ThinkingModeConfig> setMode(@PathVariable String sessionId,
                                                      @Valid @RequestBody ModeRequest request) {
        return ResponseEntity.ok(thinkingService.setThinkingMode(sessionId, request.getMode()));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        thinkingService.deleteSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/history")
    public ResponseEntity<List<ThoughtRecord>> history(
            @RequestParam(value = "sessionId", required = false) String sessionId,
            @RequestParam(value = "branchId", required = false) String branchId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(thinkingService.getHistory(sessionId, branchId, limit));
    }

    @DeleteMapping("/history")
    public ResponseEntity<Void> clearHistory() {
        thinkingService.clearHistory();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public ResponseEntity<EngineStats> stats() {
        return ResponseEntity.ok(thinkingService.getStats());
    }

    @GetMapping("/metrics")
    public ResponseEntity<MetricsSnapshot> metrics() {
        return ResponseEntity.ok(thinkingService.getMetrics());
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus health = healthCheckService.checkHealth();
        HttpStatus status = HealthStatus.UNHEALTHY.equals(health.getStatus())
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(health);
    }
}
