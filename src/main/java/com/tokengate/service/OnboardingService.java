package com.tokengate.service;

import com.tokengate.chain.AddressFormat;
import com.tokengate.config.GateProperties;
import com.tokengate.config.MetricsConfig;
import com.tokengate.gateway.MessageButton;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.gateway.OutboundMessage;
import com.tokengate.model.GroupConfig;
import com.tokengate.model.GroupOnboardingStatus;
import com.tokengate.model.PendingWhitelistRequest;
import com.tokengate.model.RejectedGroup;
import com.tokengate.model.SetupDialog;
import com.tokengate.model.SetupStep;
import com.tokengate.model.VerificationLink;
import com.tokengate.model.WhitelistEntry;
import com.tokengate.repository.GroupConfigRepository;
import com.tokengate.repository.PendingWhitelistRepository;
import com.tokengate.repository.RejectedGroupRepository;
import com.tokengate.repository.WhitelistRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Group whitelisting with three-strike blocking, and the interactive setup dialog that produces a
 * group's {@link GroupConfig} and verification link.
 *
 * All group state (whitelist entry, pending request, strike record, configuration) is changed
 * under the group's lock.
 */
@Service
public class OnboardingService {

    private static final Logger log = LoggerFactory.getLogger(OnboardingService.class);

    public static final int MAX_REJECTIONS = 3;

    public static final String APPROVE_CALLBACK = "approve:";
    public static final String REJECT_CALLBACK = "reject:";
    public static final String OVERWRITE_YES_CALLBACK = "setup:overwrite:yes";
    public static final String OVERWRITE_NO_CALLBACK = "setup:overwrite:no";

    public enum SetupRequestOutcome { REFUSED_BLOCKED, PENDING_APPROVAL, DIALOG_STARTED }

    public enum ApprovalOutcome { APPROVED, REFUSED_BLOCKED, NOT_OWNER }

    private final WhitelistRepository whitelistRepo;
    private final PendingWhitelistRepository pendingRepo;
    private final RejectedGroupRepository rejectedRepo;
    private final GroupConfigRepository groupConfigRepo;
    private final VerificationLinkService linkService;
    private final MessagingGateway gateway;
    private final KeyLockService locks;
    private final GateProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // Setup dialogs in progress, keyed by the admin driving them
    private final ConcurrentHashMap<String, SetupDialog> dialogs = new ConcurrentHashMap<>();

    public OnboardingService(WhitelistRepository whitelistRepo,
                             PendingWhitelistRepository pendingRepo,
                             RejectedGroupRepository rejectedRepo,
                             GroupConfigRepository groupConfigRepo,
                             VerificationLinkService linkService,
                             MessagingGateway gateway,
                             KeyLockService locks,
                             GateProperties properties,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.whitelistRepo = whitelistRepo;
        this.pendingRepo = pendingRepo;
        this.rejectedRepo = rejectedRepo;
        this.groupConfigRepo = groupConfigRepo;
        this.linkService = linkService;
        this.gateway = gateway;
        this.locks = locks;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    // ---- Whitelist workflow ----

    /**
     * Handles {@code /setup} from an admin of the group. The caller has already checked that the
     * sender is a group admin or the owner.
     */
    public SetupRequestOutcome requestSetup(String groupId, String groupName, String adminId) {
        if (properties.isOwner(adminId)) {
            log.info("Owner {} sets up group {} without approval", adminId, groupId);
            startDialog(adminId, groupId);
            return SetupRequestOutcome.DIALOG_STARTED;
        }

        SetupRequestOutcome outcome = locks.withLock(KeyLockService.groupKey(groupId), () -> {
            if (rejectedRepo.isBlocked(groupId)) {
                return SetupRequestOutcome.REFUSED_BLOCKED;
            }
            if (whitelistRepo.isWhitelisted(groupId)) {
                return SetupRequestOutcome.DIALOG_STARTED;
            }
            pendingRepo.save(PendingWhitelistRequest.builder()
                    .groupId(groupId)
                    .groupName(groupName)
                    .requestingAdminId(adminId)
                    .requestedAt(clock.millis())
                    .build());
            return SetupRequestOutcome.PENDING_APPROVAL;
        });

        switch (outcome) {
            case REFUSED_BLOCKED:
                log.info("Refused setup request for blocked group {}", groupId);
                metricsConfig.recordWhitelistDecision("refused_blocked");
                notifyGroup(groupId, "This group has been blocked from using this bot.");
                break;
            case PENDING_APPROVAL:
                log.info("Whitelist request for group {} ({}) by admin {}", groupId, groupName, adminId);
                metricsConfig.recordWhitelistDecision("requested");
                notifyGroup(groupId, "This group is not approved yet. The request was sent to the bot owner; "
                        + "setup continues in your private chat once it is approved.");
                notifyOwnerOfRequest(groupId, groupName, adminId);
                break;
            case DIALOG_STARTED:
                startDialog(adminId, groupId);
                break;
        }
        return outcome;
    }

    public ApprovalOutcome approve(String groupId, String ownerId) {
        if (!properties.isOwner(ownerId)) {
            log.warn("User {} tried to approve group {} without being the owner", ownerId, groupId);
            return ApprovalOutcome.NOT_OWNER;
        }

        AtomicReference<PendingWhitelistRequest> approved = new AtomicReference<>();
        boolean blocked = locks.withLock(KeyLockService.groupKey(groupId), () -> {
            if (rejectedRepo.isBlocked(groupId)) {
                return true;
            }
            approved.set(pendingRepo.findByGroupId(groupId));
            whitelistRepo.save(WhitelistEntry.builder()
                    .groupId(groupId)
                    .whitelisted(true)
                    .approvedAt(clock.millis())
                    .build());
            pendingRepo.delete(groupId);
            return false;
        });

        if (blocked) {
            log.info("Approval of blocked group {} refused", groupId);
            return ApprovalOutcome.REFUSED_BLOCKED;
        }

        metricsConfig.recordWhitelistDecision("approved");
        log.info("Group {} whitelisted by owner", groupId);

        PendingWhitelistRequest request = approved.get();
        if (request != null) {
            notifyUser(request.getRequestingAdminId(), OutboundMessage.text(
                    "Your setup request for " + displayName(request.getGroupName(), groupId) + " was approved."));
            startDialog(request.getRequestingAdminId(), groupId);
        }
        return ApprovalOutcome.APPROVED;
    }

    /**
     * Records a strike against the group's pending request. Without a pending request nothing
     * happens and null is returned.
     */
    public RejectedGroup reject(String groupId, String ownerId) {
        if (!properties.isOwner(ownerId)) {
            log.warn("User {} tried to reject group {} without being the owner", ownerId, groupId);
            return null;
        }

        AtomicReference<PendingWhitelistRequest> rejected = new AtomicReference<>();
        RejectedGroup updated = locks.withLock(KeyLockService.groupKey(groupId), () -> {
            PendingWhitelistRequest pending = pendingRepo.findByGroupId(groupId);
            if (pending == null) {
                return null;
            }
            pendingRepo.delete(groupId);
            rejected.set(pending);

            long now = clock.millis();
            RejectedGroup current = rejectedRepo.findByGroupId(groupId);
            RejectedGroup next = current == null
                    ? RejectedGroup.builder().groupId(groupId).firstRejectedAt(now).build()
                    : current.toBuilder().build();
            next.setRejectionCount(next.getRejectionCount() + 1);
            next.setLastRejectedAt(now);
            next.setGroupName(pending.getGroupName());
            next.setLastAdminId(pending.getRequestingAdminId());
            next.setBlocked(next.isBlocked() || next.getRejectionCount() >= MAX_REJECTIONS);
            rejectedRepo.save(next);
            return next;
        });

        if (updated == null) {
            log.info("Reject for group {} ignored: no pending request", groupId);
            return null;
        }

        PendingWhitelistRequest request = rejected.get();
        String name = displayName(request.getGroupName(), groupId);
        if (updated.isBlocked()) {
            metricsConfig.recordWhitelistDecision("blocked");
            log.warn("Group {} blocked after {} rejections", groupId, updated.getRejectionCount());
            notifyUser(request.getRequestingAdminId(), OutboundMessage.text(
                    "Your setup request for " + name + " was rejected. The group has now been rejected "
                            + MAX_REJECTIONS + " times and is permanently blocked."));
        } else {
            metricsConfig.recordWhitelistDecision("rejected");
            log.info("Group {} rejected ({} of {})", groupId, updated.getRejectionCount(), MAX_REJECTIONS);
            notifyUser(request.getRequestingAdminId(), OutboundMessage.text(
                    "Your setup request for " + name + " was rejected (" + updated.getRejectionCount()
                            + " of " + MAX_REJECTIONS + " before the group is blocked)."));
        }
        return updated;
    }

    // ---- Setup dialog ----

    public boolean hasActiveDialog(String adminId) {
        return dialogs.containsKey(adminId);
    }

    public SetupDialog findDialog(String adminId) {
        SetupDialog dialog = dialogs.get(adminId);
        return dialog != null ? dialog.toBuilder().build() : null;
    }

    /**
     * Feeds one reply of the admin into their setup dialog.
     *
     * @return false when the admin has no dialog in progress
     */
    public boolean handleSetupInput(String adminId, String text) {
        SetupDialog dialog = dialogs.get(adminId);
        if (dialog == null) {
            return false;
        }

        List<OutboundMessage> replies = new ArrayList<>();
        locks.runWithLock(KeyLockService.groupKey(dialog.getGroupId()), () -> advance(adminId, text, replies));
        for (OutboundMessage reply : replies) {
            notifyUser(adminId, reply);
        }
        return true;
    }

    public boolean cancelSetup(String adminId) {
        SetupDialog removed = dialogs.remove(adminId);
        if (removed == null) {
            return false;
        }
        log.info("Admin {} cancelled setup of group {}", adminId, removed.getGroupId());
        notifyUser(adminId, OutboundMessage.text("Setup cancelled."));
        return true;
    }

    @Scheduled(fixedRateString = "${gate.verification.idle-sweep-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "60")
    public void scheduledDialogExpiry() {
        expireIdleDialogs();
    }

    public int expireIdleDialogs() {
        long now = clock.millis();
        int expired = 0;
        for (SetupDialog dialog : new ArrayList<>(dialogs.values())) {
            if (isIdle(dialog, now) && dialogs.remove(dialog.getAdminUserId(), dialog)) {
                expired++;
                notifyUser(dialog.getAdminUserId(), OutboundMessage.text(
                        "Setup timed out due to inactivity. Run /setup in the group to start again."));
            }
        }
        if (expired > 0) {
            log.info("Expired {} idle setup dialogs", expired);
        }
        return expired;
    }

    // ---- Queries ----

    /**
     * Text for {@code /status} in a group. Null for blocked groups, which get no answer.
     */
    public String describeStatus(String groupId) {
        if (rejectedRepo.isBlocked(groupId)) {
            return null;
        }

        GroupConfig config = groupConfigRepo.findByGroupId(groupId);
        if (config != null) {
            String link = linkService.currentDeepLink(groupId);
            return "Token gate configuration:\n"
                    + "Chain: " + config.getChainId() + "\n"
                    + "Token: " + config.getTokenAddress() + "\n"
                    + "Minimum balance: " + config.getMinBalance().stripTrailingZeros().toPlainString() + "\n"
                    + "Verifier: " + config.getVerifierAddress() + "\n"
                    + "Verification link: " + (link != null ? link : "none");
        }
        if (pendingRepo.findByGroupId(groupId) != null) {
            return "This group's setup request is waiting for the bot owner's approval.";
        }
        if (whitelistRepo.isWhitelisted(groupId)) {
            return "This group is approved but not set up yet. Run /setup to configure it.";
        }
        return "This group is not approved yet. Run /setup to request access.";
    }

    public GroupOnboardingStatus getGroupStatus(String groupId) {
        RejectedGroup rejection = rejectedRepo.findByGroupId(groupId);
        return GroupOnboardingStatus.builder()
                .groupId(groupId)
                .whitelisted(whitelistRepo.isWhitelisted(groupId))
                .blocked(rejection != null && rejection.isBlocked())
                .pendingRequest(pendingRepo.findByGroupId(groupId))
                .rejection(rejection)
                .config(groupConfigRepo.findByGroupId(groupId))
                .verificationLink(linkService.currentDeepLink(groupId))
                .build();
    }

    public List<PendingWhitelistRequest> listPending() {
        return pendingRepo.findAll();
    }

    public List<RejectedGroup> listRejections() {
        return rejectedRepo.findAll();
    }

    public List<RejectedGroup> listBlocked() {
        return rejectedRepo.findBlocked();
    }

    public List<WhitelistEntry> listWhitelisted() {
        return whitelistRepo.findAllWhitelisted();
    }

    public RejectedGroup findStrikes(String groupId) {
        return rejectedRepo.findByGroupId(groupId);
    }

    // ---- internals ----

    private void startDialog(String adminId, String groupId) {
        long now = clock.millis();
        boolean configured = groupConfigRepo.findByGroupId(groupId) != null;

        SetupDialog dialog = SetupDialog.builder()
                .adminUserId(adminId)
                .groupId(groupId)
                .chainId(AddressFormat.canonicalChain(properties.getChainId()))
                .step(configured ? SetupStep.CONFIRM_OVERWRITE : SetupStep.TOKEN_ADDRESS)
                .startedAt(now)
                .lastActivityAt(now)
                .build();
        SetupDialog replaced = dialogs.put(adminId, dialog);
        if (replaced != null && !replaced.getGroupId().equals(groupId)) {
            log.info("Admin {} abandoned setup of group {} for group {}", adminId, replaced.getGroupId(), groupId);
        }

        try {
            gateway.sendDirectMessage(adminId, promptFor(dialog));
            log.info("Setup dialog for group {} started with admin {}", groupId, adminId);
        } catch (MessagingException e) {
            // Bots cannot open a private chat the user never started
            log.warn("Could not reach admin {} privately for setup of group {}: {}", adminId, groupId, e.getMessage());
            dialogs.remove(adminId, dialog);
            notifyGroup(groupId, "Open a private chat with @" + properties.getBotUsername()
                    + " and press Start, then run /setup again.");
        }
    }

    // Caller holds the group lock
    private void advance(String adminId, String text, List<OutboundMessage> replies) {
        SetupDialog dialog = dialogs.get(adminId);
        if (dialog == null) {
            return;
        }

        long now = clock.millis();
        if (isIdle(dialog, now)) {
            dialogs.remove(adminId);
            replies.add(OutboundMessage.text("Setup timed out due to inactivity. Run /setup in the group to start again."));
            return;
        }

        String input = text == null ? "" : text.trim();
        String keyword = input.toLowerCase(Locale.ROOT);
        if (keyword.equals("cancel") || keyword.equals("/cancel")) {
            dialogs.remove(adminId);
            replies.add(OutboundMessage.text("Setup cancelled."));
            return;
        }

        dialog.setLastActivityAt(now);
        switch (dialog.getStep()) {
            case CONFIRM_OVERWRITE:
                if (keyword.equals("yes") || keyword.equals("y")) {
                    dialog.setStep(SetupStep.TOKEN_ADDRESS);
                    replies.add(promptFor(dialog));
                } else if (keyword.equals("no") || keyword.equals("n")) {
                    dialogs.remove(adminId);
                    replies.add(OutboundMessage.text("Setup cancelled. The current configuration is kept."));
                } else {
                    replies.add(promptFor(dialog));
                }
                break;
            case TOKEN_ADDRESS:
                if (!AddressFormat.isValid(dialog.getChainId(), input)) {
                    replies.add(OutboundMessage.text("Invalid token address. " + promptFor(dialog).text()));
                    break;
                }
                dialog.setTokenAddress(input);
                dialog.setStep(SetupStep.MIN_BALANCE);
                replies.add(promptFor(dialog));
                break;
            case MIN_BALANCE:
                BigDecimal minBalance = parsePositive(input);
                if (minBalance == null) {
                    replies.add(OutboundMessage.text("The minimum balance must be a positive number. "
                            + promptFor(dialog).text()));
                    break;
                }
                dialog.setMinBalance(minBalance);
                dialog.setStep(SetupStep.VERIFIER_ADDRESS);
                replies.add(promptFor(dialog));
                break;
            case VERIFIER_ADDRESS:
                if (!AddressFormat.isValid(dialog.getChainId(), input)) {
                    replies.add(OutboundMessage.text("Invalid verifier address. " + promptFor(dialog).text()));
                    break;
                }
                replies.add(complete(dialog, input, now));
                dialogs.remove(adminId);
                break;
        }
    }

    private OutboundMessage complete(SetupDialog dialog, String verifierAddress, long now) {
        GroupConfig config = GroupConfig.builder()
                .groupId(dialog.getGroupId())
                .chainId(dialog.getChainId())
                .tokenAddress(dialog.getTokenAddress())
                .minBalance(dialog.getMinBalance())
                .verifierAddress(verifierAddress)
                .configuredBy(dialog.getAdminUserId())
                .updatedAt(now)
                .build();
        groupConfigRepo.save(config);
        VerificationLink link = linkService.mint(dialog.getGroupId());

        log.info("Group {} configured by {}: token {} min {} on {}", config.getGroupId(), config.getConfiguredBy(),
                config.getTokenAddress(), config.getMinBalance(), config.getChainId());

        return OutboundMessage.text("Setup complete.\n"
                + "Chain: " + config.getChainId() + "\n"
                + "Token: " + config.getTokenAddress() + "\n"
                + "Minimum balance: " + config.getMinBalance().stripTrailingZeros().toPlainString() + "\n"
                + "Verifier: " + config.getVerifierAddress() + "\n\n"
                + "Share this verification link with people who want to join:\n" + linkService.deepLink(link));
    }

    private OutboundMessage promptFor(SetupDialog dialog) {
        switch (dialog.getStep()) {
            case CONFIRM_OVERWRITE:
                return OutboundMessage.withButtons(
                        "This group is already set up. Replace the current configuration? (yes/no)",
                        MessageButton.callback("Yes", OVERWRITE_YES_CALLBACK),
                        MessageButton.callback("No", OVERWRITE_NO_CALLBACK));
            case TOKEN_ADDRESS:
                return OutboundMessage.text("Send the token contract address on " + dialog.getChainId() + ".");
            case MIN_BALANCE:
                return OutboundMessage.text("Send the minimum token balance members must hold.");
            default:
                return OutboundMessage.text(
                        "Send the verifier wallet address (members send 1 token there to prove ownership).");
        }
    }

    private boolean isIdle(SetupDialog dialog, long now) {
        return now - dialog.getLastActivityAt()
                > TimeUnit.MINUTES.toMillis(properties.getVerification().getInactivityMinutes());
    }

    private void notifyOwnerOfRequest(String groupId, String groupName, String adminId) {
        if (properties.getOwnerUserId() == null) {
            log.warn("No owner configured; whitelist request for group {} cannot be decided", groupId);
            return;
        }
        RejectedGroup strikes = rejectedRepo.findByGroupId(groupId);
        int count = strikes != null ? strikes.getRejectionCount() : 0;
        notifyUser(properties.getOwnerUserId(), OutboundMessage.withButtons(
                "Whitelist request\nGroup: " + displayName(groupName, groupId) + " (" + groupId + ")\n"
                        + "Admin: " + adminId + "\n"
                        + "Previous rejections: " + count + " of " + MAX_REJECTIONS,
                MessageButton.callback("Approve", APPROVE_CALLBACK + groupId),
                MessageButton.callback("Reject", REJECT_CALLBACK + groupId)));
    }

    private void notifyUser(String userId, OutboundMessage message) {
        try {
            gateway.sendDirectMessage(userId, message);
        } catch (MessagingException e) {
            log.error("Could not message user {}", userId, e);
        }
    }

    private void notifyGroup(String groupId, String text) {
        try {
            gateway.sendGroupMessage(groupId, OutboundMessage.text(text));
        } catch (MessagingException e) {
            log.error("Could not message group {}", groupId, e);
        }
    }

    private static BigDecimal parsePositive(String input) {
        try {
            BigDecimal value = new BigDecimal(input);
            return value.signum() > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String displayName(String groupName, String groupId) {
        return groupName != null && !groupName.isBlank() ? groupName : groupId;
    }
}
