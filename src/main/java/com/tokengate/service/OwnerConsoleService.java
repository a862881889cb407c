package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.model.PendingWhitelistRequest;
import com.tokengate.model.RejectedGroup;
import com.tokengate.model.WhitelistEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * The owner's {@code /admin} commands, sent to the bot in a private chat.
 */
@Service
public class OwnerConsoleService {

    private static final Logger log = LoggerFactory.getLogger(OwnerConsoleService.class);

    static final String USAGE = "Admin commands:\n"
            + "/admin pending - open whitelist requests\n"
            + "/admin approve <groupId> - whitelist a group\n"
            + "/admin reject <groupId> - reject a group's request\n"
            + "/admin list - whitelisted groups\n"
            + "/admin blocked - blocked groups\n"
            + "/admin rejections - groups with rejections\n"
            + "/admin strikes <groupId> - rejection record of one group";

    private final OnboardingService onboardingService;
    private final GateProperties properties;

    public OwnerConsoleService(OnboardingService onboardingService, GateProperties properties) {
        this.onboardingService = onboardingService;
        this.properties = properties;
    }

    /**
     * Runs one console command.
     *
     * @return the reply, or null when the sender is not the owner (they get no answer)
     */
    public String handle(String userId, List<String> args) {
        if (!properties.isOwner(userId)) {
            log.warn("Ignoring /admin from non-owner {}", userId);
            return null;
        }
        if (args.isEmpty()) {
            return USAGE;
        }

        String command = args.get(0).toLowerCase(Locale.ROOT);
        String groupId = args.size() > 1 ? args.get(1) : null;
        log.info("Owner console: {} {}", command, groupId != null ? groupId : "");

        switch (command) {
            case "pending":
                return pending();
            case "approve":
                return groupId == null ? "Usage: /admin approve <groupId>" : approve(userId, groupId);
            case "reject":
                return groupId == null ? "Usage: /admin reject <groupId>" : reject(userId, groupId);
            case "list":
                return whitelisted();
            case "blocked":
                return blocked();
            case "rejections":
                return rejections();
            case "strikes":
                return groupId == null ? "Usage: /admin strikes <groupId>" : strikes(groupId);
            default:
                return USAGE;
        }
    }

    private String pending() {
        List<PendingWhitelistRequest> requests = onboardingService.listPending();
        if (requests.isEmpty()) return "No pending whitelist requests.";

        StringBuilder sb = new StringBuilder("Pending whitelist requests:");
        for (PendingWhitelistRequest request : requests) {
            sb.append("\n- ").append(request.getGroupId())
              .append(" (").append(request.getGroupName()).append(")")
              .append(" by ").append(request.getRequestingAdminId())
              .append(" at ").append(Instant.ofEpochMilli(request.getRequestedAt()));
        }
        return sb.toString();
    }

    private String approve(String ownerId, String groupId) {
        switch (onboardingService.approve(groupId, ownerId)) {
            case APPROVED:
                return "Group " + groupId + " approved.";
            case REFUSED_BLOCKED:
                return "Group " + groupId + " is blocked and cannot be approved.";
            default:
                return "Not allowed.";
        }
    }

    private String reject(String ownerId, String groupId) {
        RejectedGroup result = onboardingService.reject(groupId, ownerId);
        if (result == null) {
            return "Group " + groupId + " has no pending request.";
        }
        return result.isBlocked()
                ? "Group " + groupId + " rejected and now blocked."
                : "Group " + groupId + " rejected (" + result.getRejectionCount() + " of "
                        + OnboardingService.MAX_REJECTIONS + ").";
    }

    private String whitelisted() {
        List<WhitelistEntry> entries = onboardingService.listWhitelisted();
        if (entries.isEmpty()) return "No whitelisted groups.";

        StringBuilder sb = new StringBuilder("Whitelisted groups:");
        for (WhitelistEntry entry : entries) {
            sb.append("\n- ").append(entry.getGroupId());
        }
        return sb.toString();
    }

    private String blocked() {
        List<RejectedGroup> groups = onboardingService.listBlocked();
        if (groups.isEmpty()) return "No blocked groups.";

        StringBuilder sb = new StringBuilder("Blocked groups:");
        for (RejectedGroup group : groups) {
            sb.append("\n- ").append(group.getGroupId()).append(" (").append(group.getGroupName()).append(")");
        }
        return sb.toString();
    }

    private String rejections() {
        List<RejectedGroup> groups = onboardingService.listRejections();
        if (groups.isEmpty()) return "No rejected groups.";

        StringBuilder sb = new StringBuilder("Rejected groups:");
        for (RejectedGroup group : groups) {
            sb.append("\n- ").append(group.getGroupId())
              .append(" (").append(group.getGroupName()).append("): ")
              .append(group.getRejectionCount()).append(" of ").append(OnboardingService.MAX_REJECTIONS)
              .append(group.isBlocked() ? ", blocked" : "");
        }
        return sb.toString();
    }

    private String strikes(String groupId) {
        RejectedGroup group = onboardingService.findStrikes(groupId);
        if (group == null) {
            return "Group " + groupId + " has no rejections.";
        }
        return "Group " + groupId + " (" + group.getGroupName() + ")\n"
                + "Rejections: " + group.getRejectionCount() + " of " + OnboardingService.MAX_REJECTIONS + "\n"
                + "First rejected: " + Instant.ofEpochMilli(group.getFirstRejectedAt()) + "\n"
                + "Last rejected: " + Instant.ofEpochMilli(group.getLastRejectedAt()) + "\n"
                + "Last admin: " + group.getLastAdminId() + "\n"
                + "Blocked: " + (group.isBlocked() ? "yes" : "no");
    }
}
