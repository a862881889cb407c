package com.tokengate.controller;

import com.tokengate.config.TelegramConfig;
import com.tokengate.gateway.event.InboundEvent;
import com.tokengate.gateway.telegram.TelegramUpdate;
import com.tokengate.gateway.telegram.TelegramUpdateTranslator;
import com.tokengate.service.InboundEventRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/telegram")
@Tag(name = "Telegram Webhook", description = "Update intake for the Telegram Bot API")
public class TelegramWebhookController {

    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookController.class);

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TelegramUpdateTranslator translator;
    private final InboundEventRouter router;
    private final TelegramConfig telegramConfig;

    public TelegramWebhookController(TelegramUpdateTranslator translator,
                                     InboundEventRouter router,
                                     TelegramConfig telegramConfig) {
        this.translator = translator;
        this.router = router;
        this.telegramConfig = telegramConfig;
    }

    @PostMapping("/webhook")
    @Operation(summary = "Receive a Telegram update",
               description = "Always answers 200 once the secret matches, so Telegram does not redeliver updates that failed to process")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @RequestBody TelegramUpdate update) {
        String expected = telegramConfig.getWebhookSecret();
        if (expected == null || expected.isBlank()) {
            log.error("Rejected webhook call {}: telegram.webhook-secret is not configured", update.updateId());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "webhook secret not configured"));
        }
        if (!expected.equals(secret)) {
            log.warn("Rejected webhook call {} with a wrong secret token", update.updateId());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "invalid secret token"));
        }

        List<InboundEvent> events = translator.translate(update);
        int failed = 0;
        for (InboundEvent event : events) {
            try {
                router.dispatch(event);
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to handle {} from update {}", event, update.updateId(), e);
            }
        }
        return ResponseEntity.ok(Map.of("ok", true, "events", events.size(), "failed", failed));
    }
}
