package com.tokengate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "moralis")
public class MoralisConfig {

    private String baseUrl = "https://deep-index.moralis.io/api/v2.2";
    private String apiKey;
    private int connectTimeoutMs = 3000;
    private int readTimeoutMs = 10000;
    // Upper bound on transfers fetched per confirmation check
    private int transferPageSize = 50;
}
