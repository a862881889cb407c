package com.tokengate.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokengate.config.MoralisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * {@link ChainClient} backed by the Moralis EVM REST API.
 *
 * Raw integer amounts are scaled by the token's decimals (18 when Moralis omits them).
 * HTTP failures are translated into {@link ChainClientException} kinds; retrying is left to
 * {@link RetryingChainClient}.
 */
@Component("moralisChainClient")
public class MoralisChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(MoralisChainClient.class);

    private static final int DEFAULT_DECIMALS = 18;

    private final RestTemplate restTemplate;
    private final MoralisConfig config;

    public MoralisChainClient(@Qualifier("moralisRestTemplate") RestTemplate restTemplate,
                              MoralisConfig config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    public BigDecimal getBalance(String chainId, String tokenAddress, String address) {
        String chain = AddressFormat.canonicalChain(chainId);

        JsonNode body = call("getBalance", () -> restTemplate.getForObject(
                "/{address}/erc20?chain={chain}&token_addresses[0]={token}",
                JsonNode.class, address, chain, tokenAddress));

        if (body == null || !body.isArray()) {
            throw new ChainClientException(ChainClientException.Kind.TRANSIENT,
                    "Malformed balance response for " + address);
        }

        for (JsonNode token : body) {
            if (AddressFormat.sameAddress(token.path("token_address").asText(null), tokenAddress)) {
                BigDecimal balance = toUnits(token.path("balance").asText("0"),
                        token.path("decimals").asInt(DEFAULT_DECIMALS));
                log.debug("Balance of {} for token {} on {}: {}", address, tokenAddress, chain, balance);
                return balance;
            }
        }
        // Moralis omits tokens the wallet never held
        return BigDecimal.ZERO;
    }

    @Override
    public boolean findTransfer(String chainId, String tokenAddress, String from, String to,
                                BigDecimal minAmount, long sinceTimestamp) {
        String chain = AddressFormat.canonicalChain(chainId);
        String fromDate = Instant.ofEpochMilli(sinceTimestamp).toString();

        JsonNode body;
        try {
            body = call("findTransfer", () -> restTemplate.getForObject(
                    "/{address}/erc20/transfers?chain={chain}&contract_addresses[0]={token}&from_date={fromDate}&limit={limit}",
                    JsonNode.class, from, chain, tokenAddress, fromDate, config.getTransferPageSize()));
        } catch (ChainClientException e) {
            if (e.getKind() == ChainClientException.Kind.NOT_FOUND) {
                log.debug("No transfer history for {} on {}: {}", from, chain, e.getMessage());
                return false;
            }
            throw e;
        }

        JsonNode transfers = body != null ? body.path("result") : null;
        if (transfers == null || !transfers.isArray()) {
            throw new ChainClientException(ChainClientException.Kind.TRANSIENT,
                    "Malformed transfer response for " + from);
        }

        for (JsonNode transfer : transfers) {
            if (!AddressFormat.sameAddress(transfer.path("from_address").asText(null), from)) continue;
            if (!AddressFormat.sameAddress(transfer.path("to_address").asText(null), to)) continue;
            if (!AddressFormat.sameAddress(transfer.path("address").asText(null), tokenAddress)) continue;

            BigDecimal amount;
            try {
                amount = toUnits(transfer.path("value").asText("0"),
                        transfer.path("token_decimals").asInt(DEFAULT_DECIMALS));
            } catch (NumberFormatException e) {
                log.warn("Skipping transfer {} with unparseable value '{}'",
                        transfer.path("transaction_hash").asText("?"), transfer.path("value").asText());
                continue;
            }

            if (amount.compareTo(minAmount) >= 0) {
                log.info("Qualifying transfer {} from {} to {}: {} tokens",
                        transfer.path("transaction_hash").asText("?"), from, to, amount);
                return true;
            }
        }
        return false;
    }

    private JsonNode call(String operation, Supplier<JsonNode> request) {
        try {
            return request.get();
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            if (status == 429) {
                throw new ChainClientException(ChainClientException.Kind.RATE_LIMITED,
                        operation + " rate limited by Moralis", e);
            }
            if (status == 400 || status == 404) {
                throw new ChainClientException(ChainClientException.Kind.NOT_FOUND,
                        operation + " rejected by Moralis: " + status, e);
            }
            log.error("Moralis {} failed with {} (check moralis.api-key)", operation, status);
            throw new ChainClientException(ChainClientException.Kind.TRANSIENT,
                    operation + " failed with " + status, e);
        } catch (HttpServerErrorException e) {
            throw new ChainClientException(ChainClientException.Kind.TRANSIENT,
                    operation + " failed with " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ChainClientException(ChainClientException.Kind.TRANSIENT,
                    operation + " timed out: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ChainClientException(ChainClientException.Kind.TRANSIENT,
                    operation + " failed: " + e.getMessage(), e);
        }
    }

    static BigDecimal toUnits(String raw, int decimals) {
        return new BigDecimal(new BigInteger(raw.trim())).movePointLeft(decimals);
    }
}
