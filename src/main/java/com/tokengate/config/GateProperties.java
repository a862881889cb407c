package com.tokengate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Data
@Configuration
@ConfigurationProperties(prefix = "gate")
public class GateProperties {

    // Privileged owner: approves whitelist requests, bypasses verification
    private String ownerUserId;

    // Used to build verification deep links (https://t.me/<bot>?start=<token>)
    private String botUsername = "tokengatebot";

    // The single chain every new group is configured for
    private String chainId = "eth";

    private Verification verification = new Verification();

    private Invite invite = new Invite();

    private Reverification reverification = new Reverification();

    public boolean isOwner(String userId) {
        return ownerUserId != null && ownerUserId.equals(userId);
    }

    @Data
    public static class Verification {
        // Sessions (and setup dialogs) idle longer than this are expired
        private int inactivityMinutes = 10;
        private int maxTransferAttempts = 3;
        private int retryCooldownSeconds = 60;
        // Amount of token the user sends to the verifier address as proof of ownership
        private BigDecimal proofAmount = BigDecimal.ONE;
        // Transfers sent this long before the user was asked still count
        private int transferLookbackMinutes = 30;
        private int idleSweepIntervalSeconds = 60;
    }

    @Data
    public static class Invite {
        private int ttlMinutes = 10;
        private int purgeIntervalSeconds = 60;
    }

    @Data
    public static class Reverification {
        private boolean enabled = true;
        private int intervalMinutes = 360;
        private int initialDelayMinutes = 5;
    }
}
