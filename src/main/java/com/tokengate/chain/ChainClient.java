package com.tokengate.chain;

import java.math.BigDecimal;

/**
 * Read-only view of token balances and transfers on one chain.
 *
 * Implementations signal failures with {@link ChainClientException}; transient kinds may be retried
 * by the caller, {@link ChainClientException.Kind#NOT_FOUND} means the token or address is invalid.
 */
public interface ChainClient {

    /**
     * Current balance of {@code tokenAddress} held by {@code address}, in whole token units.
     */
    BigDecimal getBalance(String chainId, String tokenAddress, String address);

    /**
     * Whether {@code from} sent at least {@code minAmount} of the token to {@code to}
     * at or after {@code sinceTimestamp} (epoch milliseconds).
     */
    boolean findTransfer(String chainId, String tokenAddress, String from, String to,
                         BigDecimal minAmount, long sinceTimestamp);
}
