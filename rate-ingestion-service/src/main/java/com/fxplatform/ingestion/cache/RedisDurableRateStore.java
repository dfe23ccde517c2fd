package com.fxplatform.ingestion.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.exception.CacheUnavailableException;
import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Redis-backed second tier. Values are JSON; keys are {@code fx:rates:BASE:QUOTE} for rates and
 * {@code fx:rates:alert:BASE:QUOTE} for alerts. Every Redis error surfaces as
 * {@link CacheUnavailableException}.
 */
public class RedisDurableRateStore implements DurableRateStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDurableRateStore.class);

    static final String KEY_PREFIX   = "fx:rates:";
    static final String ALERT_PREFIX = KEY_PREFIX + "alert:";
    static final String PROBE_KEY    = KEY_PREFIX + "health:probe";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisDurableRateStore(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper  = objectMapper;
    }

    @Override
    public Mono<Void> save(ConsolidatedRate rate, Duration ttl) {
        String key = rateKey(rate.pair());
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(rate))
            .flatMap(json -> ttl == null
                ? redisTemplate.opsForValue().set(key, json)
                : redisTemplate.opsForValue().set(key, json, ttl))
            .onErrorMap(e -> unavailable("write " + key, e))
            .then();
    }

    @Override
    public Mono<ConsolidatedRate> find(PairKey pair) {
        String key = rateKey(pair);
        return redisTemplate.opsForValue().get(key)
            .map(json -> read(key, json))
            .onErrorMap(e -> unavailable("read " + key, e));
    }

    @Override
    public Mono<Boolean> delete(PairKey pair) {
        return redisTemplate.delete(rateKey(pair))
            .map(count -> count > 0)
            .onErrorMap(e -> unavailable("delete " + rateKey(pair), e));
    }

    @Override
    public Mono<Void> saveAlert(RateAlert alert, Duration ttl) {
        String key = alertKey(alert.pair());
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(alert))
            .flatMap(json -> redisTemplate.opsForValue().set(key, json, ttl))
            .onErrorMap(e -> unavailable("write " + key, e))
            .then();
    }

    @Override
    public Mono<Boolean> deleteAlert(PairKey pair) {
        return redisTemplate.delete(alertKey(pair))
            .map(count -> count > 0)
            .onErrorMap(e -> unavailable("delete " + alertKey(pair), e));
    }

    @Override
    public Mono<Boolean> ping() {
        String token = UUID.randomUUID().toString();
        return redisTemplate.opsForValue().set(PROBE_KEY, token, Duration.ofSeconds(10))
            .then(redisTemplate.opsForValue().get(PROBE_KEY))
            .map(token::equals)
            .defaultIfEmpty(false)
            .onErrorMap(e -> unavailable("probe", e));
    }

    private ConsolidatedRate read(String key, String json) {
        try {
            return objectMapper.readValue(json, ConsolidatedRate.class);
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException("Corrupt cache entry " + key, e);
        }
    }

    private static CacheUnavailableException unavailable(String operation, Throwable cause) {
        if (cause instanceof CacheUnavailableException cue) {
            return cue;
        }
        log.debug("Redis operation failed. operation={} error={}", operation, cause.getMessage());
        return new CacheUnavailableException("Redis " + operation + " failed: " + cause.getMessage(), cause);
    }

    static String rateKey(PairKey pair) {
        return KEY_PREFIX + pair.base() + ":" + pair.quote();
    }

    static String alertKey(PairKey pair) {
        return ALERT_PREFIX + pair.base() + ":" + pair.quote();
    }
}
