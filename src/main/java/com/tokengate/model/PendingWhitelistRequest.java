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
@Schema(description = "A group waiting for the owner's whitelist decision")
public class PendingWhitelistRequest {

    @Schema(description = "Group chat identifier", example = "-1001234567890")
    private String groupId;

    @Schema(description = "Group title at request time", example = "Diamond Hands")
    private String groupName;

    @Schema(description = "Admin who ran /setup", example = "5550001")
    private String requestingAdminId;

    @Schema(description = "Request time, epoch milliseconds")
    private long requestedAt;
}
