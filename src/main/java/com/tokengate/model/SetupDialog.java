package com.tokengate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SetupDialog {
    private String adminUserId;
    private String groupId;
    private SetupStep step;
    private String chainId;
    private String tokenAddress;
    private BigDecimal minBalance;
    private long startedAt;
    private long lastActivityAt;
}
