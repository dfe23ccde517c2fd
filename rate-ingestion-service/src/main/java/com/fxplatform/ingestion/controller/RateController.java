package com.fxplatform.ingestion.controller;

import com.fxplatform.common.event.AlertDirection;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.ResolvedRate;
import com.fxplatform.ingestion.cache.LatestRates;
import com.fxplatform.ingestion.cache.RateAlert;
import com.fxplatform.ingestion.cache.RateAlertService;
import com.fxplatform.ingestion.cache.RateCache;
import com.fxplatform.ingestion.orchestrator.IngestionHealth;
import com.fxplatform.ingestion.orchestrator.IngestionOrchestrator;
import com.fxplatform.ingestion.provider.ProviderStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Read side of the rate engine plus the operational endpoints (refresh, health, alerts).
 */
@RestController
@RequestMapping("/api/v1/rates")
public class RateController {

    private static final Logger log = LoggerFactory.getLogger(RateController.class);

    private final RateCache cache;
    private final IngestionOrchestrator orchestrator;
    private final RateAlertService alertService;

    public RateController(RateCache cache, IngestionOrchestrator orchestrator, RateAlertService alertService) {
        this.cache        = cache;
        this.orchestrator = orchestrator;
        this.alertService = alertService;
    }

    @GetMapping("/{from}/{to}")
    public Mono<ResponseEntity<ResolvedRate>> getRate(@PathVariable String from, @PathVariable String to) {
        return cache.getRate(from, to)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/latest")
    public Mono<LatestRates> getLatestRates(@RequestParam(required = false) String currencies) {
        List<String> requested = currencies == null || currencies.isBlank()
            ? List.of()
            : Arrays.asList(currencies.split(","));
        return cache.getLatestRates(requested);
    }

    @PostMapping("/refresh")
    public Mono<Map<String, Object>> refresh() {
        log.info("Manual refresh requested. state={}", orchestrator.state());
        return orchestrator.refresh()
            .map(ran -> Map.<String, Object>of("triggered", ran, "state", orchestrator.state()));
    }

    @GetMapping("/health")
    public Mono<IngestionHealth> health() {
        return orchestrator.health();
    }

    @GetMapping("/providers")
    public List<ProviderStats> providers() {
        return orchestrator.getProviderStats();
    }

    // ── Alerts ──────────────────────────────────────────────────────────────

    @PostMapping("/alerts")
    public Mono<RateAlert> setAlert(@RequestBody AlertRequest request) {
        PairKey pair = PairKey.of(request.baseCurrency(), request.quoteCurrency());
        return alertService.setAlert(pair, request.threshold(), request.direction());
    }

    @DeleteMapping("/alerts/{base}/{quote}")
    public Mono<ResponseEntity<Void>> removeAlert(@PathVariable String base, @PathVariable String quote) {
        return alertService.removeAlert(PairKey.of(base, quote))
            .map(removed -> removed
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping("/alerts")
    public List<RateAlert> alerts() {
        return alertService.getAlerts();
    }

    public record AlertRequest(String baseCurrency, String quoteCurrency, double threshold, AlertDirection direction) {}
}
