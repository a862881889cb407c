package com.tokengate.gateway.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The subset of a Telegram Bot API {@code Update} the bot reacts to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(
        @JsonProperty("update_id") long updateId,
        Message message,
        @JsonProperty("callback_query") CallbackQuery callbackQuery) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(
            @JsonProperty("message_id") long messageId,
            User from,
            Chat chat,
            String text,
            @JsonProperty("new_chat_members") List<User> newChatMembers) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            long id,
            @JsonProperty("is_bot") boolean bot,
            String username,
            @JsonProperty("first_name") String firstName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chat(long id, String type, String title) {

        public boolean isPrivate() {
            return "private".equals(type);
        }

        public boolean isGroup() {
            return "group".equals(type) || "supergroup".equals(type);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CallbackQuery(String id, User from, String data, Message message) {
    }
}
