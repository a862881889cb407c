package com.tokengate.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Strike record of a group whose whitelist requests were rejected")
public class RejectedGroup {

    @Schema(description = "Group chat identifier", example = "-1001234567890")
    private String groupId;

    @Schema(description = "Owner rejections so far", example = "2")
    private int rejectionCount;

    private String groupName;

    @Schema(description = "Admin behind the most recently rejected request")
    private String lastAdminId;

    private long firstRejectedAt;
    private long lastRejectedAt;

    @Schema(description = "Set once the third rejection lands; never cleared")
    private boolean blocked;
}
