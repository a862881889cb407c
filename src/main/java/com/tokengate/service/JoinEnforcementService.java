package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.config.MetricsConfig;
import com.tokengate.gateway.MessageButton;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.gateway.OutboundMessage;
import com.tokengate.model.UserRecord;
import com.tokengate.repository.GroupConfigRepository;
import com.tokengate.repository.RejectedGroupRepository;
import com.tokengate.repository.UserRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reacts to members joining a gated group: the joiner's invite is spent, and anyone who got in
 * without a verified record is removed again and pointed at the verification link.
 */
@Service
public class JoinEnforcementService {

    private static final Logger log = LoggerFactory.getLogger(JoinEnforcementService.class);

    public enum JoinOutcome { IGNORED, ADMITTED, REMOVED }

    private final InviteLinkManager inviteLinkManager;
    private final GroupConfigRepository groupConfigRepo;
    private final RejectedGroupRepository rejectedRepo;
    private final UserRecordRepository userRecordRepo;
    private final VerificationLinkService linkService;
    private final MessagingGateway gateway;
    private final GateProperties properties;
    private final MetricsConfig metricsConfig;

    public JoinEnforcementService(InviteLinkManager inviteLinkManager,
                                  GroupConfigRepository groupConfigRepo,
                                  RejectedGroupRepository rejectedRepo,
                                  UserRecordRepository userRecordRepo,
                                  VerificationLinkService linkService,
                                  MessagingGateway gateway,
                                  GateProperties properties,
                                  MetricsConfig metricsConfig) {
        this.inviteLinkManager = inviteLinkManager;
        this.groupConfigRepo = groupConfigRepo;
        this.rejectedRepo = rejectedRepo;
        this.userRecordRepo = userRecordRepo;
        this.linkService = linkService;
        this.gateway = gateway;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    public JoinOutcome onMemberJoined(String groupId, String userId) {
        inviteLinkManager.onMemberJoined(groupId, userId);

        if (groupConfigRepo.findByGroupId(groupId) == null || rejectedRepo.isBlocked(groupId)) {
            return JoinOutcome.IGNORED;
        }
        if (properties.isOwner(userId)) {
            return JoinOutcome.ADMITTED;
        }

        UserRecord record = userRecordRepo.find(groupId, userId);
        if (record != null && record.isVerified()) {
            metricsConfig.recordJoinEnforcement("admitted");
            log.info("Verified user {} joined group {}", userId, groupId);
            return JoinOutcome.ADMITTED;
        }

        try {
            gateway.removeMember(groupId, userId);
        } catch (MessagingException e) {
            log.error("Could not remove unverified user {} from group {}", userId, groupId, e);
            metricsConfig.recordJoinEnforcement("removal_failed");
            return JoinOutcome.IGNORED;
        }
        metricsConfig.recordJoinEnforcement("removed");
        log.info("Removed unverified user {} from group {}", userId, groupId);

        String link = linkService.currentDeepLink(groupId);
        String text = "This group is token-gated and you have not been verified. "
                + "Verify your token holdings first, then join with the invite link you receive.";
        OutboundMessage message = link != null
                ? OutboundMessage.withButtons(text + "\nStart verification here: " + link,
                        MessageButton.link("Start verification", link))
                : OutboundMessage.text(text);
        try {
            gateway.sendDirectMessage(userId, message);
        } catch (MessagingException e) {
            log.warn("Could not send verification instructions to removed user {}: {}", userId, e.getMessage());
        }
        return JoinOutcome.REMOVED;
    }
}
