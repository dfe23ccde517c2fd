package com.fxplatform.ingestion.controller;

import com.fxplatform.common.model.CurrencyDefinition;
import com.fxplatform.common.model.CurrencyPair;
import com.fxplatform.common.model.RegionalRestriction;
import com.fxplatform.common.model.RestrictionCheck;
import com.fxplatform.common.registry.CurrencyRegistry;
import com.fxplatform.common.registry.FormattedAmount;
import com.fxplatform.common.registry.RegistryStatistics;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Currency registry administration. Registry calls are synchronous and in-memory, so these
 * handlers return plain values rather than publishers.
 */
@RestController
@RequestMapping("/api/v1/currencies")
public class CurrencyController {

    private final CurrencyRegistry registry;

    public CurrencyController(CurrencyRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public Map<String, Object> currencies() {
        return Map.of(
            "baseCurrency", registry.getBaseCurrency(),
            "active",       registry.getActiveCurrencies(),
            "currencies",   registry.getAllCurrencies());
    }

    @GetMapping("/{code}")
    public ResponseEntity<CurrencyDefinition> currency(@PathVariable String code) {
        return registry.getCurrencyDefinition(code)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<CurrencyDefinition> addCurrency(@RequestBody CurrencyDefinition definition) {
        registry.addCurrency(definition);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(registry.getCurrencyDefinition(definition.code()).orElse(definition));
    }

    @DeleteMapping("/{code}")
    public ResponseEntity<Void> removeCurrency(@PathVariable String code) {
        registry.removeCurrency(code);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{code}/activate")
    public Map<String, Object> activate(@PathVariable String code) {
        boolean changed = registry.activateCurrency(code);
        return Map.of("currency", code.toUpperCase(), "active", true, "changed", changed);
    }

    @PostMapping("/{code}/deactivate")
    public Map<String, Object> deactivate(@PathVariable String code) {
        boolean changed = registry.deactivateCurrency(code);
        return Map.of("currency", code.toUpperCase(), "active", false, "changed", changed);
    }

    @GetMapping("/pairs")
    public List<CurrencyPair> pairs() {
        return registry.getAllCurrencyPairs();
    }

    @GetMapping("/pairs/{base}/{quote}")
    public ResponseEntity<CurrencyPair> pair(@PathVariable String base, @PathVariable String quote) {
        return registry.getCurrencyPair(base, quote)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{code}/validate-amount")
    public FormattedAmount validateAmount(@PathVariable String code, @RequestParam String amount) {
        registry.validateCurrencyAmount(amount, code);
        return registry.formatAmount(new BigDecimal(amount.trim()), code);
    }

    @GetMapping("/{code}/restrictions")
    public RestrictionCheck restrictions(@PathVariable String code, @RequestParam String region) {
        return registry.checkRegionalRestrictions(code, region);
    }

    @GetMapping("/restrictions")
    public Map<String, RegionalRestriction> allRestrictions() {
        return registry.getRegionalRestrictions();
    }

    @PostMapping("/restrictions/{region}/{code}")
    public ResponseEntity<Void> addRestriction(@PathVariable String region, @PathVariable String code,
                                               @RequestParam(required = false) String reason) {
        registry.addRegionalRestriction(region, code, reason);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @DeleteMapping("/restrictions/{region}/{code}")
    public ResponseEntity<Void> removeRestriction(@PathVariable String region, @PathVariable String code) {
        return registry.removeRegionalRestriction(region, code)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/statistics")
    public RegistryStatistics statistics() {
        return registry.getStatistics();
    }
}
