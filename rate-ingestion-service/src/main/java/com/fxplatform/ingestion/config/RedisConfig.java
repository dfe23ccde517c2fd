package com.fxplatform.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.ingestion.cache.DurableRateStore;
import com.fxplatform.ingestion.cache.RedisDurableRateStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

/**
 * Durable cache tier. Connection settings come from {@code spring.data.redis.*};
 * the template itself is Spring Boot's auto-configured one.
 */
@Configuration
public class RedisConfig {

    @Bean
    public DurableRateStore durableRateStore(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisDurableRateStore(redisTemplate, objectMapper);
    }
}
