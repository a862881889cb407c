package com.tokengate.chain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressFormatTest {

    @Test
    void isValid_acceptsHexAddressesOfSupportedChains() {
        assertThat(AddressFormat.isValid("eth", "0x6B175474E89094C44Da98b954EedeAC495271d0F")).isTrue();
        assertThat(AddressFormat.isValid("polygon", " 0x1111111111111111111111111111111111111111 ")).isTrue();
    }

    @Test
    void isValid_rejectsMalformedAddresses() {
        assertThat(AddressFormat.isValid("eth", "0x123")).isFalse();
        assertThat(AddressFormat.isValid("eth", "1111111111111111111111111111111111111111")).isFalse();
        assertThat(AddressFormat.isValid("eth", "0xZZ11111111111111111111111111111111111111")).isFalse();
        assertThat(AddressFormat.isValid("eth", null)).isFalse();
    }

    @Test
    void isValid_rejectsUnsupportedChain() {
        assertThat(AddressFormat.isValid("solana", "0x1111111111111111111111111111111111111111")).isFalse();
    }

    @Test
    void canonicalChain_resolvesAliases() {
        assertThat(AddressFormat.canonicalChain("MAINNET")).isEqualTo("eth");
        assertThat(AddressFormat.canonicalChain("0x38")).isEqualTo("bsc");
        assertThat(AddressFormat.canonicalChain("matic")).isEqualTo("polygon");
        assertThatThrownBy(() -> AddressFormat.canonicalChain("tron"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sameAddress_ignoresCaseAndWhitespace() {
        assertThat(AddressFormat.sameAddress("0xABCDEF", " 0xabcdef")).isTrue();
        assertThat(AddressFormat.sameAddress("0xABCDEF", null)).isFalse();
    }
}
