package com.tokengate.gateway;

public record InviteHandle(String groupId, String link, long expiresAt) {
}
