package com.tokengate.gateway;

import java.util.List;

public record OutboundMessage(String text, List<MessageButton> buttons) {

    public OutboundMessage {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public static OutboundMessage text(String text) {
        return new OutboundMessage(text, List.of());
    }

    public static OutboundMessage withButtons(String text, MessageButton... buttons) {
        return new OutboundMessage(text, List.of(buttons));
    }
}
