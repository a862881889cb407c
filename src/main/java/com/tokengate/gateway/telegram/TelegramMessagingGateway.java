package com.tokengate.gateway.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokengate.gateway.InviteHandle;
import com.tokengate.gateway.MessageButton;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.gateway.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link MessagingGateway} over the Telegram Bot HTTP API.
 */
@Component
public class TelegramMessagingGateway implements MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramMessagingGateway.class);

    private static final Set<String> MEMBER_STATUSES = Set.of("creator", "administrator", "member");
    private static final Set<String> ADMIN_STATUSES = Set.of("creator", "administrator");

    // Telegram caps invite link names at 32 characters
    private static final int MAX_INVITE_NAME = 32;

    private final RestTemplate restTemplate;

    public TelegramMessagingGateway(@Qualifier("telegramRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void sendDirectMessage(String userId, OutboundMessage message) {
        send(userId, message);
    }

    @Override
    public void sendGroupMessage(String groupId, OutboundMessage message) {
        send(groupId, message);
    }

    @Override
    public InviteHandle createOneTimeInvite(String groupId, String label, long expiresAt) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", groupId);
        body.put("name", label.length() > MAX_INVITE_NAME ? label.substring(0, MAX_INVITE_NAME) : label);
        body.put("expire_date", expiresAt / 1000);
        body.put("member_limit", 1);
        body.put("creates_join_request", false);

        JsonNode result = call("createChatInviteLink", body);
        String link = result.path("invite_link").asText(null);
        if (link == null) {
            throw new MessagingException("createChatInviteLink returned no link for group " + groupId);
        }
        return new InviteHandle(groupId, link, expiresAt);
    }

    @Override
    public void revokeInvite(String groupId, String inviteLink) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", groupId);
        body.put("invite_link", inviteLink);
        call("revokeChatInviteLink", body);
    }

    @Override
    public void removeMember(String groupId, String userId) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", groupId);
        body.put("user_id", Long.parseLong(userId));
        call("banChatMember", body);

        // Lift the ban straight away so the user may rejoin once verified again
        body.put("only_if_banned", true);
        call("unbanChatMember", body);
    }

    @Override
    public boolean isGroupMember(String groupId, String userId) {
        return MEMBER_STATUSES.contains(memberStatus(groupId, userId));
    }

    @Override
    public boolean isGroupAdmin(String groupId, String userId) {
        return ADMIN_STATUSES.contains(memberStatus(groupId, userId));
    }

    @Override
    public void acknowledge(String callbackId, String text) {
        Map<String, Object> body = new HashMap<>();
        body.put("callback_query_id", callbackId);
        if (text != null) {
            body.put("text", text);
        }
        call("answerCallbackQuery", body);
    }

    private String memberStatus(String groupId, String userId) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", groupId);
        body.put("user_id", Long.parseLong(userId));
        return call("getChatMember", body).path("status").asText("");
    }

    private void send(String chatId, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", chatId);
        body.put("text", message.text());
        body.put("disable_web_page_preview", true);
        if (!message.buttons().isEmpty()) {
            body.put("reply_markup", Map.of("inline_keyboard", keyboard(message.buttons())));
        }
        call("sendMessage", body);
    }

    // One button per row
    private List<List<Map<String, String>>> keyboard(List<MessageButton> buttons) {
        List<List<Map<String, String>>> rows = new ArrayList<>();
        for (MessageButton button : buttons) {
            Map<String, String> key = new HashMap<>();
            key.put("text", button.label());
            if (button.url() != null) {
                key.put("url", button.url());
            } else {
                key.put("callback_data", button.callbackData());
            }
            rows.add(List.of(key));
        }
        return rows;
    }

    private JsonNode call(String method, Map<String, Object> body) {
        JsonNode response;
        try {
            response = restTemplate.postForObject("/" + method, body, JsonNode.class);
        } catch (RestClientException e) {
            log.error("Telegram {} failed for chat {}", method, body.get("chat_id"), e);
            throw new MessagingException("Telegram " + method + " failed: " + e.getMessage(), e);
        }

        if (response == null || !response.path("ok").asBoolean(false)) {
            String description = response != null ? response.path("description").asText("no description") : "empty body";
            log.error("Telegram {} rejected for chat {}: {}", method, body.get("chat_id"), description);
            throw new MessagingException("Telegram " + method + " rejected: " + description);
        }
        return response.path("result");
    }
}
