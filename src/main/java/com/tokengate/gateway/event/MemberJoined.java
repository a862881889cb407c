package com.tokengate.gateway.event;

public record MemberJoined(String groupId, String userId) implements InboundEvent {
}
