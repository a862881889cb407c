package com.tokengate.chain;

import com.tokengate.config.MetricsConfig;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Wraps the provider client with bounded exponential-backoff retries on transient failures.
 * When retries run out the last {@link ChainClientException} propagates to the caller.
 */
@Primary
@Component
public class RetryingChainClient implements ChainClient {

    private final ChainClient delegate;
    private final Retry retry;
    private final MetricsConfig metricsConfig;

    public RetryingChainClient(@Qualifier("moralisChainClient") ChainClient delegate,
                               Retry chainClientRetry,
                               MetricsConfig metricsConfig) {
        this.delegate = delegate;
        this.retry = chainClientRetry;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public BigDecimal getBalance(String chainId, String tokenAddress, String address) {
        return execute("getBalance", () -> delegate.getBalance(chainId, tokenAddress, address));
    }

    @Override
    public boolean findTransfer(String chainId, String tokenAddress, String from, String to,
                                BigDecimal minAmount, long sinceTimestamp) {
        return execute("findTransfer",
                () -> delegate.findTransfer(chainId, tokenAddress, from, to, minAmount, sinceTimestamp));
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return retry.executeSupplier(call);
        } catch (ChainClientException e) {
            metricsConfig.recordChainFailure(operation, e.getKind().name());
            throw e;
        }
    }
}
