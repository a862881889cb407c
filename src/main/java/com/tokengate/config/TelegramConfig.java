package com.tokengate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "telegram")
public class TelegramConfig {

    private String botToken;
    private String apiBaseUrl = "https://api.telegram.org";
    // Compared against the X-Telegram-Bot-Api-Secret-Token header; while blank every webhook call is rejected
    private String webhookSecret;
    private int connectTimeoutMs = 3000;
    private int readTimeoutMs = 10000;
}
