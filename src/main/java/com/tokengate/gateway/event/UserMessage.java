package com.tokengate.gateway.event;

/**
 * Free text a user sent the bot in a direct conversation.
 */
public record UserMessage(String userId, String text) implements InboundEvent {
}
