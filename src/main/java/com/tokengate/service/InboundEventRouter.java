package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.gateway.OutboundMessage;
import com.tokengate.gateway.event.AdminCommand;
import com.tokengate.gateway.event.ButtonPressed;
import com.tokengate.gateway.event.InboundEvent;
import com.tokengate.gateway.event.MemberJoined;
import com.tokengate.gateway.event.UserMessage;
import com.tokengate.model.RejectedGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Locale;
import java.util.List;

/**
 * Dispatches transport-neutral events to the verification engine, the onboarding workflow, the
 * owner console and join enforcement.
 */
@Service
public class InboundEventRouter {

    private static final Logger log = LoggerFactory.getLogger(InboundEventRouter.class);

    static final String HELP = "I gate private groups behind token ownership.\n"
            + "Members: open the verification link a group admin shared with you, send your wallet address, "
            + "then send 1 token to the verifier address to prove ownership.\n"
            + "Admins: add me to your group as an administrator and run /setup there. /status shows the current setup.";

    private final VerificationSessionEngine engine;
    private final OnboardingService onboardingService;
    private final OwnerConsoleService ownerConsole;
    private final JoinEnforcementService joinEnforcement;
    private final MessagingGateway gateway;
    private final GateProperties properties;

    public InboundEventRouter(VerificationSessionEngine engine,
                              OnboardingService onboardingService,
                              OwnerConsoleService ownerConsole,
                              JoinEnforcementService joinEnforcement,
                              MessagingGateway gateway,
                              GateProperties properties) {
        this.engine = engine;
        this.onboardingService = onboardingService;
        this.ownerConsole = ownerConsole;
        this.joinEnforcement = joinEnforcement;
        this.gateway = gateway;
        this.properties = properties;
    }

    public void dispatch(InboundEvent event) {
        if (event instanceof UserMessage message) {
            onUserMessage(message);
        } else if (event instanceof MemberJoined joined) {
            joinEnforcement.onMemberJoined(joined.groupId(), joined.userId());
        } else if (event instanceof AdminCommand command) {
            onGroupCommand(command);
        } else if (event instanceof ButtonPressed button) {
            onButton(button);
        } else {
            log.debug("No handler for event {}", event);
        }
    }

    private void onUserMessage(UserMessage message) {
        String userId = message.userId();
        String text = message.text();
        List<String> words = Arrays.asList(text.trim().split("\\s+"));
        String first = words.get(0).toLowerCase(Locale.ROOT);

        if (first.equals("/start")) {
            if (words.size() > 1) {
                engine.startSession(userId, words.get(1));
            } else {
                reply(userId, HELP);
            }
            return;
        }
        if (first.equals("/help")) {
            reply(userId, HELP);
            return;
        }
        if (first.equals("/admin")) {
            String answer = ownerConsole.handle(userId, words.subList(1, words.size()));
            if (answer != null) {
                reply(userId, answer);
            }
            return;
        }
        if (onboardingService.hasActiveDialog(userId)) {
            onboardingService.handleSetupInput(userId, text);
            return;
        }
        engine.handleDirectMessage(userId, text);
    }

    private void onGroupCommand(AdminCommand command) {
        switch (command.command()) {
            case "setup":
                if (!isAdminOrOwner(command.groupId(), command.adminId())) {
                    groupReply(command.groupId(), "Only group admins can run /setup.");
                    return;
                }
                onboardingService.requestSetup(command.groupId(), command.groupName(), command.adminId());
                break;
            case "status":
                if (!isAdminOrOwner(command.groupId(), command.adminId())) {
                    return;
                }
                String status = onboardingService.describeStatus(command.groupId());
                if (status != null) {
                    groupReply(command.groupId(), status);
                }
                break;
            case "help":
                groupReply(command.groupId(), HELP);
                break;
            default:
                log.debug("Ignoring group command /{} in {}", command.command(), command.groupId());
        }
    }

    private void onButton(ButtonPressed button) {
        String data = button.data();
        String userId = button.userId();
        String ack = null;

        if (data.startsWith(VerificationSessionEngine.DONE_CALLBACK)) {
            engine.confirmTransfer(data.substring(VerificationSessionEngine.DONE_CALLBACK.length()), userId);
        } else if (data.startsWith(VerificationSessionEngine.CANCEL_CALLBACK)) {
            engine.cancel(data.substring(VerificationSessionEngine.CANCEL_CALLBACK.length()), userId);
        } else if (data.startsWith(OnboardingService.APPROVE_CALLBACK)) {
            String groupId = data.substring(OnboardingService.APPROVE_CALLBACK.length());
            switch (onboardingService.approve(groupId, userId)) {
                case APPROVED:
                    ack = "Group approved";
                    break;
                case REFUSED_BLOCKED:
                    ack = "Group is blocked";
                    break;
                default:
                    ack = "Not allowed";
            }
        } else if (data.startsWith(OnboardingService.REJECT_CALLBACK)) {
            String groupId = data.substring(OnboardingService.REJECT_CALLBACK.length());
            if (!properties.isOwner(userId)) {
                ack = "Not allowed";
            } else {
                RejectedGroup result = onboardingService.reject(groupId, userId);
                ack = result == null ? "Nothing to reject"
                        : result.isBlocked() ? "Group rejected and blocked"
                        : "Group rejected (" + result.getRejectionCount() + " of " + OnboardingService.MAX_REJECTIONS + ")";
            }
        } else if (data.equals(OnboardingService.OVERWRITE_YES_CALLBACK)) {
            onboardingService.handleSetupInput(userId, "yes");
        } else if (data.equals(OnboardingService.OVERWRITE_NO_CALLBACK)) {
            onboardingService.handleSetupInput(userId, "no");
        } else {
            log.debug("Unknown button data '{}' from {}", data, userId);
        }

        try {
            gateway.acknowledge(button.callbackId(), ack);
        } catch (MessagingException e) {
            log.warn("Could not acknowledge button press {}: {}", button.callbackId(), e.getMessage());
        }
    }

    private boolean isAdminOrOwner(String groupId, String userId) {
        if (properties.isOwner(userId)) {
            return true;
        }
        try {
            return gateway.isGroupAdmin(groupId, userId);
        } catch (MessagingException e) {
            log.warn("Could not check admin status of {} in group {}: {}", userId, groupId, e.getMessage());
            return false;
        }
    }

    private void reply(String userId, String text) {
        try {
            gateway.sendDirectMessage(userId, OutboundMessage.text(text));
        } catch (MessagingException e) {
            log.error("Could not message user {}", userId, e);
        }
    }

    private void groupReply(String groupId, String text) {
        try {
            gateway.sendGroupMessage(groupId, OutboundMessage.text(text));
        } catch (MessagingException e) {
            log.error("Could not message group {}", groupId, e);
        }
    }
}
