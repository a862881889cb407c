package com.tokengate.config;

import com.tokengate.chain.ChainClientException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for chain-data provider calls.
 *
 * Only transient provider failures (timeouts, 5xx, rate limits) are retried, with exponential
 * backoff capped at {@code maxBackoffMs}. Permanent failures surface immediately.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "chain.retry")
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    public static final String CHAIN_CLIENT_RETRY = "chainClient";

    private int maxAttempts = 3;
    private long initialBackoffMs = 500;
    private double multiplier = 2.0;
    private long maxBackoffMs = 4000;

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.of(chainRetryConfig());
    }

    @Bean
    public Retry chainClientRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(CHAIN_CLIENT_RETRY, chainRetryConfig());
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Chain call retry #{} after {}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"))
                .onError(event -> log.warn("Chain call failed after {} attempts: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    public RetryConfig chainRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, multiplier, maxBackoffMs))
                .retryOnException(ResilienceConfig::isRetryable)
                .build();
    }

    static boolean isRetryable(Throwable t) {
        return t instanceof ChainClientException && ((ChainClientException) t).isTransient();
    }
}
