package com.fxplatform.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fxplatform.common.consolidation.RateConsolidator;
import com.fxplatform.common.consolidation.ReliabilityWeightedConsolidator;
import com.fxplatform.common.event.IngestionListener;
import com.fxplatform.common.publisher.RateEventPublisher;
import com.fxplatform.common.registry.CurrencyRegistry;
import com.fxplatform.common.registry.RegistrySettings;
import com.fxplatform.common.validation.AnomalyDetector;
import com.fxplatform.common.validation.ArbitrageDetector;
import com.fxplatform.common.validation.RateValidationEngine;
import com.fxplatform.common.validation.ValidationSettings;
import com.fxplatform.ingestion.cache.DurableRateStore;
import com.fxplatform.ingestion.cache.RateAlertService;
import com.fxplatform.ingestion.cache.RateCache;
import com.fxplatform.ingestion.orchestrator.IngestionEventDispatcher;
import com.fxplatform.ingestion.orchestrator.IngestionOrchestrator;
import com.fxplatform.ingestion.orchestrator.IngestionSettings;
import com.fxplatform.ingestion.provider.RateProvider;
import com.fxplatform.ingestion.publisher.LoggingRateEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Wires the framework-free engine components from common-lib into the service.
 */
@Configuration
public class IngestionConfig {

    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

    // ── Registry ─────────────────────────────────────────────────────────────
    @Value("${fx.base-currency:USD}")
    private String baseCurrency;

    @Value("${fx.registry.supported-currencies:}")
    private List<String> supportedCurrencies;

    @Value("${fx.registry.min-amount:0.01}")
    private BigDecimal minAmount;

    @Value("${fx.registry.max-amount:1000000}")
    private BigDecimal maxAmount;

    @Value("${fx.registry.regional-restrictions-enabled:true}")
    private boolean regionalRestrictionsEnabled;

    // ── Ingestion loop ───────────────────────────────────────────────────────
    @Value("${fx.ingestion.target-currencies:EUR,GBP,JPY,CAD,AUD,CHF,CNY}")
    private List<String> targetCurrencies;

    @Value("${fx.ingestion.update-interval-ms:60000}")
    private long updateIntervalMs;

    @Value("${fx.ingestion.max-failures:5}")
    private int maxFailures;

    @Value("${fx.ingestion.reconnect-delay-ms:5000}")
    private long reconnectDelayMs;

    @Value("${fx.ingestion.streaming-enabled:true}")
    private boolean streamingEnabled;

    @Value("${fx.providers.enabled:fxapi,exchangerate,currencylayer,reuters,bloomberg,oanda,fxcm}")
    private List<String> enabledProviders;

    // ── Validation ───────────────────────────────────────────────────────────
    @Value("${fx.validation.max-rate-deviation:0.10}")
    private double maxRateDeviation;

    @Value("${fx.validation.min-quality-score:70}")
    private int minQualityScore;

    @Value("${fx.validation.stale-data-threshold-ms:300000}")
    private long staleDataThresholdMs;

    @Value("${fx.validation.max-spread-percent:5.0}")
    private double maxSpreadPercent;

    @Value("${fx.validation.min-provider-count:2}")
    private int minProviderCount;

    @Value("${fx.validation.anomaly-window-size:100}")
    private int anomalyWindowSize;

    @Value("${fx.validation.anomaly-min-history:10}")
    private int anomalyMinHistory;

    @Value("${fx.validation.anomaly-cutoff:1.0}")
    private double anomalyCutoff;

    @Value("${fx.validation.max-triangular-deviation:0.001}")
    private double maxTriangularDeviation;

    @Value("${fx.validation.consistency-tolerance:0.001}")
    private double consistencyTolerance;

    // ── Cache ────────────────────────────────────────────────────────────────
    @Value("${fx.cache.max-entries:1000}")
    private int cacheMaxEntries;

    @Value("${fx.cache.streaming-ttl-ms:60000}")
    private long streamingTtlMs;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CurrencyRegistry currencyRegistry() {
        return new CurrencyRegistry(new RegistrySettings(baseCurrency, supportedCurrencies, minAmount, maxAmount,
                                                         regionalRestrictionsEnabled));
    }

    @Bean
    public RateConsolidator rateConsolidator(Clock clock) {
        return new ReliabilityWeightedConsolidator(clock);
    }

    @Bean
    public ValidationSettings validationSettings() {
        return new ValidationSettings(maxRateDeviation, minQualityScore, Duration.ofMillis(staleDataThresholdMs),
                                      maxSpreadPercent, minProviderCount, anomalyWindowSize, anomalyMinHistory,
                                      anomalyCutoff, maxTriangularDeviation, consistencyTolerance);
    }

    @Bean
    public IngestionEventDispatcher ingestionEventDispatcher(List<IngestionListener> listeners) {
        log.info("Ingestion listeners registered. count={}", listeners.size());
        return new IngestionEventDispatcher(listeners);
    }

    @Bean
    public RateValidationEngine rateValidationEngine(ValidationSettings settings, Clock clock,
                                                     IngestionEventDispatcher dispatcher) {
        RateValidationEngine engine = new RateValidationEngine(settings,
            new AnomalyDetector(settings.anomalyWindowSize(), settings.anomalyMinHistory()),
            new ArbitrageDetector(settings.maxTriangularDeviation(), clock),
            clock);
        engine.addAnomalyListener(dispatcher::anomaly);
        return engine;
    }

    @Bean
    public RateAlertService rateAlertService(DurableRateStore durableRateStore, IngestionEventDispatcher dispatcher,
                                             Clock clock) {
        return new RateAlertService(durableRateStore, dispatcher, clock);
    }

    @Bean
    public RateCache rateCache(DurableRateStore durableRateStore, CurrencyRegistry registry,
                               RateAlertService rateAlertService, Clock clock) {
        RateCache cache = new RateCache(durableRateStore, registry, rateAlertService, clock, cacheMaxEntries,
                                        Duration.ofMillis(streamingTtlMs));
        registry.addListener(cache::onRegistryChange);
        return cache;
    }

    @Bean
    @ConditionalOnProperty(name = "fx.events.publisher", havingValue = "log")
    public RateEventPublisher loggingRateEventPublisher() {
        return new LoggingRateEventPublisher();
    }

    @Bean
    public IngestionSettings ingestionSettings() {
        return new IngestionSettings(targetCurrencies, Duration.ofMillis(updateIntervalMs), maxFailures,
                                     Duration.ofMillis(reconnectDelayMs), streamingEnabled);
    }

    @Bean
    public IngestionOrchestrator ingestionOrchestrator(List<RateProvider> providers,
                                                       RateConsolidator rateConsolidator,
                                                       RateValidationEngine rateValidationEngine,
                                                       RateCache rateCache,
                                                       RateEventPublisher rateEventPublisher,
                                                       IngestionEventDispatcher dispatcher,
                                                       CurrencyRegistry registry,
                                                       IngestionSettings ingestionSettings,
                                                       Clock clock) {
        List<String> enabled = enabledProviders.stream().map(s -> s.trim().toLowerCase(Locale.ROOT)).toList();
        List<RateProvider> active = providers.stream()
            .filter(p -> enabled.contains(p.name()))
            .toList();
        log.info("Rate providers configured. enabled={} available={}",
                 active.stream().map(RateProvider::name).toList(), providers.size());
        return new IngestionOrchestrator(active, rateConsolidator, rateValidationEngine, rateCache,
                                         rateEventPublisher, dispatcher, registry, ingestionSettings, clock,
                                         Schedulers.parallel());
    }
}
