package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.model.VerificationLink;
import com.tokengate.repository.VerificationLinkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

@Service
public class VerificationLinkService {

    private static final Logger log = LoggerFactory.getLogger(VerificationLinkService.class);

    private static final int TOKEN_BYTES = 16;

    private final VerificationLinkRepository linkRepo;
    private final GateProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public VerificationLinkService(VerificationLinkRepository linkRepo,
                                   GateProperties properties,
                                   Clock clock) {
        this.linkRepo = linkRepo;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Mints and stores a fresh link for the group. Earlier links of the group stay valid.
     */
    public VerificationLink mint(String groupId) {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);

        VerificationLink link = VerificationLink.builder()
                .token(Base64.getUrlEncoder().withoutPadding().encodeToString(bytes))
                .groupId(groupId)
                .createdAt(clock.millis())
                .build();
        linkRepo.save(link);

        log.info("Minted verification link for group {}", groupId);
        return link;
    }

    public VerificationLink resolve(String token) {
        if (token == null || token.isBlank()) return null;
        return linkRepo.findByToken(token.trim());
    }

    public VerificationLink currentLink(String groupId) {
        return linkRepo.findLatestByGroupId(groupId);
    }

    public String deepLink(VerificationLink link) {
        return "https://t.me/" + properties.getBotUsername() + "?start=" + link.getToken();
    }

    /**
     * Deep link of the group's newest verification link, or null when the group has none.
     */
    public String currentDeepLink(String groupId) {
        VerificationLink link = currentLink(groupId);
        return link != null ? deepLink(link) : null;
    }
}
