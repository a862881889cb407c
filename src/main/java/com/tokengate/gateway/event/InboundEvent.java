package com.tokengate.gateway.event;

/**
 * Transport-neutral event delivered by the chat transport.
 */
public interface InboundEvent {
}
