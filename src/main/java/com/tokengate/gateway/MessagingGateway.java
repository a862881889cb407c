package com.tokengate.gateway;

/**
 * Outbound side of the chat transport. Every method may throw {@link MessagingException}.
 */
public interface MessagingGateway {

    void sendDirectMessage(String userId, OutboundMessage message);

    void sendGroupMessage(String groupId, OutboundMessage message);

    /**
     * Creates an invite usable by exactly one member, valid until {@code expiresAt} (epoch millis).
     */
    InviteHandle createOneTimeInvite(String groupId, String label, long expiresAt);

    void revokeInvite(String groupId, String inviteLink);

    /**
     * Removes the member without banning them, so they can rejoin after verifying again.
     */
    void removeMember(String groupId, String userId);

    boolean isGroupMember(String groupId, String userId);

    boolean isGroupAdmin(String groupId, String userId);

    /**
     * Answers a button press so the client stops its loading indicator.
     */
    void acknowledge(String callbackId, String text);
}
