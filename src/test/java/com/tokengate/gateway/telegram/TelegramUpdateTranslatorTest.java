package com.tokengate.gateway.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokengate.gateway.event.AdminCommand;
import com.tokengate.gateway.event.ButtonPressed;
import com.tokengate.gateway.event.InboundEvent;
import com.tokengate.gateway.event.MemberJoined;
import com.tokengate.gateway.event.UserMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramUpdateTranslatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TelegramUpdateTranslator translator = new TelegramUpdateTranslator();

    private List<InboundEvent> translate(String json) throws Exception {
        return translator.translate(objectMapper.readValue(json, TelegramUpdate.class));
    }

    @Test
    void privateText_becomesUserMessage() throws Exception {
        List<InboundEvent> events = translate("{\"update_id\":1,\"message\":{\"message_id\":5,"
                + "\"from\":{\"id\":42,\"is_bot\":false,\"first_name\":\"Ann\"},"
                + "\"chat\":{\"id\":42,\"type\":\"private\"},\"text\":\" /start abc123 \"}}");

        assertThat(events).containsExactly(new UserMessage("42", "/start abc123"));
    }

    @Test
    void groupCommandWithBotMention_becomesAdminCommand() throws Exception {
        List<InboundEvent> events = translate("{\"update_id\":2,\"message\":{\"message_id\":6,"
                + "\"from\":{\"id\":500,\"is_bot\":false},"
                + "\"chat\":{\"id\":-1001234,\"type\":\"supergroup\",\"title\":\"Holders\"},"
                + "\"text\":\"/SETUP@gatebot now\"}}");

        assertThat(events).containsExactly(
                new AdminCommand("-1001234", "Holders", "500", "setup", List.of("now")));
    }

    @Test
    void groupCommand_lowerCasedIndependentOfDefaultLocale() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        List<InboundEvent> events;
        try {
            events = translate("{\"update_id\":4,\"message\":{\"message_id\":8,"
                    + "\"from\":{\"id\":500,\"is_bot\":false},"
                    + "\"chat\":{\"id\":-1001234,\"type\":\"supergroup\",\"title\":\"Holders\"},"
                    + "\"text\":\"/INFO@gatebot\"}}");
        } finally {
            Locale.setDefault(previous);
        }

        assertThat(events).containsExactly(
                new AdminCommand("-1001234", "Holders", "500", "info", List.of()));
    }

    @Test
    void newMembers_becomeMemberJoinedExceptBots() throws Exception {
        List<InboundEvent> events = translate("{\"update_id\":3,\"message\":{\"message_id\":7,"
                + "\"from\":{\"id\":42,\"is_bot\":false},"
                + "\"chat\":{\"id\":-1001234,\"type\":\"group\",\"title\":\"Holders\"},"
                + "\"new_chat_members\":[{\"id\":42,\"is_bot\":false},{\"id\":77,\"is_bot\":true}]}}");

        assertThat(events).containsExactly(new MemberJoined("-1001234", "42"));
    }

    @Test
    void callbackQuery_becomesButtonPressed() throws Exception {
        List<InboundEvent> events = translate("{\"update_id\":4,\"callback_query\":{\"id\":\"cb-9\","
                + "\"from\":{\"id\":42,\"is_bot\":false},\"data\":\"verify:done:-1001234\"}}");

        assertThat(events).containsExactly(new ButtonPressed("42", "cb-9", "verify:done:-1001234"));
    }

    @Test
    void botAuthorsAndPlainGroupChatter_areIgnored() throws Exception {
        assertThat(translate("{\"update_id\":5,\"message\":{\"message_id\":8,"
                + "\"from\":{\"id\":9,\"is_bot\":true},\"chat\":{\"id\":9,\"type\":\"private\"},\"text\":\"hi\"}}"))
                .isEmpty();
        assertThat(translate("{\"update_id\":6,\"message\":{\"message_id\":9,"
                + "\"from\":{\"id\":42,\"is_bot\":false},"
                + "\"chat\":{\"id\":-1001234,\"type\":\"supergroup\"},\"text\":\"gm everyone\"}}"))
                .isEmpty();
        assertThat(translate("{\"update_id\":7,\"edited_message\":{}}")).isEmpty();
    }
}
