package com.tokengate.gateway.event;

public record ButtonPressed(String userId, String callbackId, String data) implements InboundEvent {
}
