package com.tokengate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * In-memory state of one member's verification attempt for one group.
 * Instances are only mutated while holding the session's key lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VerificationSession {
    private String groupId;
    private String userId;
    private SessionState state;
    private String address;
    private int attempts;               // failed transfer confirmations so far
    private long startedAt;
    private long lastActivityAt;
    private long transferRequestedAt;   // 0 until the balance check passes
    private long nextRetryAt;           // 0 when no cooldown is running
    private long revision;              // bumped on every state change

    public SessionKey key() {
        return new SessionKey(groupId, userId);
    }

    public boolean isIdle(long now, long inactivityMillis) {
        return now - lastActivityAt > inactivityMillis;
    }

    public void moveTo(SessionState next, long now) {
        this.state = next;
        this.lastActivityAt = now;
        this.revision++;
    }

    public VerificationSession snapshot() {
        return toBuilder().build();
    }
}
