package com.tokengate.gateway.event;

import java.util.List;

/**
 * A slash command issued inside a group. {@code adminId} is the sender; whether they really are
 * an admin is checked by the receiver.
 */
public record AdminCommand(String groupId, String groupName, String adminId,
                           String command, List<String> args) implements InboundEvent {

    public AdminCommand {
        args = args == null ? List.of() : List.copyOf(args);
    }
}
