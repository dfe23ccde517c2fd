package com.fxplatform.ingestion.controller;

import com.fxplatform.ingestion.orchestrator.IngestionOrchestrator;
import com.fxplatform.ingestion.orchestrator.IngestionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Operator control of the ingestion loop. A tripped breaker (state FAILED) is cleared with
 * {@code reset} or directly with {@code start}.
 */
@RestController
@RequestMapping("/api/v1/ingestion")
public class IngestionController {

    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionOrchestrator orchestrator;

    public IngestionController(IngestionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/start")
    public Mono<Map<String, Object>> start() {
        log.info("[IngestionAPI] start requested. state={}", orchestrator.state());
        return orchestrator.start().map(this::stateBody);
    }

    @PostMapping("/stop")
    public Mono<Map<String, Object>> stop() {
        log.info("[IngestionAPI] stop requested. state={}", orchestrator.state());
        return orchestrator.stop().map(this::stateBody);
    }

    @PostMapping("/reset")
    public Mono<Map<String, Object>> reset() {
        log.info("[IngestionAPI] reset requested. state={}", orchestrator.state());
        return orchestrator.reset().map(this::stateBody);
    }

    @GetMapping("/state")
    public Map<String, Object> state() {
        return stateBody(orchestrator.state());
    }

    private Map<String, Object> stateBody(IngestionState state) {
        return Map.of("state", state, "consecutiveFailures", orchestrator.consecutiveFailures());
    }
}
