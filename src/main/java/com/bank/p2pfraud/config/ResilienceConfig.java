package com.bank.p2pfraud.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import com.aerospike.client.AerospikeException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Bounded exponential backoff with jitter for writes that can hit transient storage contention.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Retry auditLogRetry(
            @Value("${fraud.audit.retry.max-attempts:3}") int maxAttempts,
            @Value("${fraud.audit.retry.base-delay-ms:100}") long baseDelayMs,
            @Value("${fraud.audit.retry.multiplier:2.0}") double multiplier,
            @Value("${fraud.audit.retry.jitter-factor:0.5}") double jitterFactor
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(baseDelayMs), multiplier, jitterFactor))
                .retryExceptions(Exception.class)
                .build();
        return Retry.of("auditLog", config);
    }

    @Bean
    public Retry registrationRetry(
            @Value("${fraud.registration.retry.max-attempts:3}") int maxAttempts,
            @Value("${fraud.registration.retry.base-delay-ms:500}") long baseDelayMs,
            @Value("${fraud.registration.retry.jitter-factor:0.5}") double jitterFactor
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(baseDelayMs), 2.0, jitterFactor))
                .retryExceptions(AerospikeException.class)
                .build();
        return Retry.of("registration", config);
    }
}
