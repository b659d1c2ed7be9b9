package com.songranker.ranking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.songranker.common.solver.SolverSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RankingConfig {

    @Value("${ranking.solver.regularization:0.01}")
    private double regularization;

    @Value("${ranking.solver.max-iterations:100}")
    private int maxIterations;

    @Value("${ranking.solver.tolerance:1e-8}")
    private double tolerance;

    @Value("${ranking.convergence.lookback:5}")
    private int lookback;

    @Value("${ranking.trigger.every-n-outcomes:5}")
    private int everyNOutcomes;

    @Value("${ranking.global.interval-minutes:2}")
    private long globalIntervalMinutes;

    @Value("${ranking.global.lock-ttl-seconds:120}")
    private long lockTtlSeconds;

    @Value("${ranking.global.lock-key-prefix:global_update_lock:}")
    private String lockKeyPrefix;

    @Bean
    public RankingSettings rankingSettings() {
        return new RankingSettings(
            new SolverSettings(regularization, maxIterations, tolerance),
            lookback,
            everyNOutcomes,
            Duration.ofMinutes(globalIntervalMinutes),
            Duration.ofSeconds(lockTtlSeconds),
            lockKeyPrefix);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
