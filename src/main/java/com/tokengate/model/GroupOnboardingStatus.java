package com.tokengate.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Everything the service knows about one group's onboarding")
public class GroupOnboardingStatus {

    private String groupId;
    private boolean whitelisted;
    private boolean blocked;

    @Schema(description = "Open whitelist request, if any")
    private PendingWhitelistRequest pendingRequest;

    @Schema(description = "Strike record, if the group was ever rejected")
    private RejectedGroup rejection;

    @Schema(description = "Token requirements, once setup completed")
    private GroupConfig config;

    @Schema(description = "Newest verification deep link", example = "https://t.me/tokengatebot?start=q3Jx0v9bW1mQ2a8sZ7k4Tg")
    private String verificationLink;
}
