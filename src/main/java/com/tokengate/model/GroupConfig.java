package com.tokengate.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Token-gating requirements of one group")
public class GroupConfig {

    @Schema(description = "Group chat identifier", example = "-1001234567890")
    private String groupId;

    @Schema(description = "Chain the token lives on", example = "eth")
    private String chainId;

    @Schema(description = "Token contract address", example = "0x6b175474e89094c44da98b954eedeac495271d0f")
    private String tokenAddress;

    @Schema(description = "Minimum token balance a member must hold", example = "100")
    private BigDecimal minBalance;

    @Schema(description = "Wallet that receives the ownership-proof transfer", example = "0x00000000b8f2fa0bcfb6d540669ba4fb6cf76611")
    private String verifierAddress;

    @Schema(description = "User who completed the setup dialog")
    private String configuredBy;

    @Schema(description = "Last setup completion, epoch milliseconds")
    private long updatedAt;
}
