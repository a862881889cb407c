package com.tokengate.chain;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Address syntax checks for the supported chains. All supported chains are EVM chains and
 * share the 0x-prefixed 20-byte hex form.
 */
public final class AddressFormat {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    // Accepted aliases → canonical chain name
    private static final Map<String, String> CHAIN_ALIASES = Map.of(
            "eth", "eth",
            "mainnet", "eth",
            "0x1", "eth",
            "bsc", "bsc",
            "binance", "bsc",
            "0x38", "bsc",
            "polygon", "polygon",
            "matic", "polygon",
            "0x89", "polygon");

    private AddressFormat() {}

    public static boolean isSupportedChain(String chainId) {
        return chainId != null && CHAIN_ALIASES.containsKey(chainId.toLowerCase(Locale.ROOT));
    }

    public static String canonicalChain(String chainId) {
        if (!isSupportedChain(chainId)) {
            throw new IllegalArgumentException("Unsupported chain: " + chainId);
        }
        return CHAIN_ALIASES.get(chainId.toLowerCase(Locale.ROOT));
    }

    public static boolean isValid(String chainId, String address) {
        return isSupportedChain(chainId) && address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
    }
}
