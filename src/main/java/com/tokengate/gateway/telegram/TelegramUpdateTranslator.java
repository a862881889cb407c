package com.tokengate.gateway.telegram;

import com.tokengate.gateway.event.AdminCommand;
import com.tokengate.gateway.event.ButtonPressed;
import com.tokengate.gateway.event.InboundEvent;
import com.tokengate.gateway.event.MemberJoined;
import com.tokengate.gateway.event.UserMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Locale;
import java.util.List;

/**
 * Maps raw Telegram updates onto transport-neutral events. Messages from bots are dropped.
 */
@Component
public class TelegramUpdateTranslator {

    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateTranslator.class);

    public List<InboundEvent> translate(TelegramUpdate update) {
        List<InboundEvent> events = new ArrayList<>();

        if (update.callbackQuery() != null) {
            TelegramUpdate.CallbackQuery query = update.callbackQuery();
            if (query.from() != null && !query.from().bot() && query.data() != null) {
                events.add(new ButtonPressed(String.valueOf(query.from().id()), query.id(), query.data()));
            }
        }

        TelegramUpdate.Message message = update.message();
        if (message != null && message.chat() != null) {
            if (message.chat().isGroup()) {
                translateGroupMessage(message, events);
            } else if (message.chat().isPrivate() && message.from() != null && !message.from().bot()
                    && message.text() != null) {
                events.add(new UserMessage(String.valueOf(message.from().id()), message.text().trim()));
            }
        }

        if (events.isEmpty()) {
            log.debug("Ignoring update {}", update.updateId());
        }
        return events;
    }

    private void translateGroupMessage(TelegramUpdate.Message message, List<InboundEvent> events) {
        String groupId = String.valueOf(message.chat().id());

        if (message.newChatMembers() != null) {
            for (TelegramUpdate.User member : message.newChatMembers()) {
                if (!member.bot()) {
                    events.add(new MemberJoined(groupId, String.valueOf(member.id())));
                }
            }
        }

        String text = message.text();
        if (text != null && text.startsWith("/") && message.from() != null && !message.from().bot()) {
            String[] parts = text.trim().split("\\s+");
            String command = parts[0].substring(1);
            int mention = command.indexOf('@');
            if (mention >= 0) {
                command = command.substring(0, mention);
            }
            if (!command.isEmpty()) {
                List<String> args = Arrays.asList(parts).subList(1, parts.length);
                events.add(new AdminCommand(groupId, message.chat().title(),
                        String.valueOf(message.from().id()), command.toLowerCase(Locale.ROOT), args));
            }
        }
    }
}
