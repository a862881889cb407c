package com.tokengate.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tokenGateOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Token Gate API")
                        .version("1.0.0")
                        .description(
                                "Token-gated access control for private group chats.\n\n" +
                                "**Verification Flow (in DM):**\n" +
                                "1. Member opens the group's verification link\n" +
                                "2. Member submits a wallet address; the token balance is checked against the group minimum\n" +
                                "3. Member sends 1 token to the verifier address and taps Done\n" +
                                "4. On a confirmed transfer the member receives a one-time invite link\n\n" +
                                "**Onboarding:** group admins run `/setup`; unknown groups need owner approval. " +
                                "Three owner rejections block a group permanently.\n\n" +
                                "**Re-verification:** every verified member is re-checked on a fixed period " +
                                "(`POST /api/v1/reverification/run` triggers a sweep on demand); members below " +
                                "the minimum balance are removed.")
                        .contact(new Contact().name("Token Gate Team")));
    }
}
