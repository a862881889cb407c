package com.tokengate.chain;

import com.tokengate.config.MetricsConfig;
import com.tokengate.config.ResilienceConfig;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryingChainClientTest {

    private static final String TOKEN = "0x6b175474e89094c44da98b954eedeac495271d0f";
    private static final String WALLET = "0x1111111111111111111111111111111111111111";

    @Mock private ChainClient delegate;
    @Mock private MetricsConfig metricsConfig;

    private RetryingChainClient client;

    @BeforeEach
    void setUp() {
        ResilienceConfig resilience = new ResilienceConfig();
        resilience.setInitialBackoffMs(1);
        resilience.setMaxBackoffMs(5);
        client = new RetryingChainClient(delegate, Retry.of("test", resilience.chainRetryConfig()), metricsConfig);
    }

    @Test
    void transientFailures_areRetried() {
        when(delegate.getBalance("eth", TOKEN, WALLET))
                .thenThrow(new ChainClientException(ChainClientException.Kind.TRANSIENT, "503"))
                .thenThrow(new ChainClientException(ChainClientException.Kind.RATE_LIMITED, "429"))
                .thenReturn(new BigDecimal("12.5"));

        assertThat(client.getBalance("eth", TOKEN, WALLET)).isEqualByComparingTo("12.5");

        verify(delegate, times(3)).getBalance("eth", TOKEN, WALLET);
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void notFound_isNotRetried() {
        when(delegate.getBalance("eth", TOKEN, WALLET))
                .thenThrow(new ChainClientException(ChainClientException.Kind.NOT_FOUND, "400"));

        assertThatThrownBy(() -> client.getBalance("eth", TOKEN, WALLET))
                .isInstanceOfSatisfying(ChainClientException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ChainClientException.Kind.NOT_FOUND));

        verify(delegate, times(1)).getBalance("eth", TOKEN, WALLET);
        verify(metricsConfig).recordChainFailure("getBalance", "NOT_FOUND");
    }

    @Test
    void exhaustedRetries_propagateLastFailure() {
        when(delegate.findTransfer(anyString(), anyString(), anyString(), anyString(), any(), anyLong()))
                .thenThrow(new ChainClientException(ChainClientException.Kind.TRANSIENT, "timeout"));

        assertThatThrownBy(() -> client.findTransfer("eth", TOKEN, WALLET, WALLET, BigDecimal.ONE, 0L))
                .isInstanceOf(ChainClientException.class)
                .hasMessage("timeout");

        verify(delegate, times(3)).findTransfer(anyString(), anyString(), anyString(), anyString(), any(), anyLong());
        verify(metricsConfig).recordChainFailure("findTransfer", "TRANSIENT");
    }
}
