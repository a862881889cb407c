package com.tokengate.model;

public record SessionKey(String groupId, String userId) {

    /**
     * Lock key shared by everything that mutates per-member state of a group:
     * verification sessions, user records and invites.
     */
    public String lockKey() {
        return "user:" + groupId + ":" + userId;
    }
}
