package com.tokengate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The outstanding one-time invite of a (group, user) pair. At most one exists per key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InviteRecord {
    private String groupId;
    private String userId;
    private String inviteLink;
    private long issuedAt;
    private long expiresAt;

    public boolean isExpired(long now) {
        return expiresAt > 0 && expiresAt <= now;
    }
}
