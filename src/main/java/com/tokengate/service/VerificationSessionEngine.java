package com.tokengate.service;

import com.tokengate.chain.AddressFormat;
import com.tokengate.chain.ChainClient;
import com.tokengate.chain.ChainClientException;
import com.tokengate.config.GateProperties;
import com.tokengate.config.MetricsConfig;
import com.tokengate.gateway.InviteHandle;
import com.tokengate.gateway.MessageButton;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.gateway.OutboundMessage;
import com.tokengate.model.GroupConfig;
import com.tokengate.model.SessionKey;
import com.tokengate.model.SessionState;
import com.tokengate.model.UserRecord;
import com.tokengate.model.VerificationLink;
import com.tokengate.model.VerificationSession;
import com.tokengate.repository.GroupConfigRepository;
import com.tokengate.repository.UserRecordRepository;
import io.micrometer.observation.annotation.Observed;
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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one member at a time through wallet submission, balance check and ownership-proof
 * transfer, ending in a one-time invite.
 *
 * Every step follows compute-then-commit: the session is advanced under its key lock, the chain
 * call runs with no lock held, and the result is applied under the lock again only if the same
 * session object is still live and its revision did not move in between. Replies are collected while locked and sent after
 * the lock is released.
 */
@Service
public class VerificationSessionEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationSessionEngine.class);

    public static final String DONE_CALLBACK = "verify:done:";
    public static final String CANCEL_CALLBACK = "verify:cancel:";

    private final GroupConfigRepository groupConfigRepo;
    private final UserRecordRepository userRecordRepo;
    private final VerificationLinkService linkService;
    private final ChainClient chainClient;
    private final InviteLinkManager inviteLinkManager;
    private final MessagingGateway gateway;
    private final KeyLockService locks;
    private final GateProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ConcurrentHashMap<SessionKey, VerificationSession> sessions = new ConcurrentHashMap<>();

    // userId → group of the session the user touched last; routes free-text DMs
    private final ConcurrentHashMap<String, String> activeGroupByUser = new ConcurrentHashMap<>();

    public VerificationSessionEngine(GroupConfigRepository groupConfigRepo,
                                     UserRecordRepository userRecordRepo,
                                     VerificationLinkService linkService,
                                     ChainClient chainClient,
                                     InviteLinkManager inviteLinkManager,
                                     MessagingGateway gateway,
                                     KeyLockService locks,
                                     GateProperties properties,
                                     MetricsConfig metricsConfig,
                                     Clock clock) {
        this.groupConfigRepo = groupConfigRepo;
        this.userRecordRepo = userRecordRepo;
        this.linkService = linkService;
        this.chainClient = chainClient;
        this.inviteLinkManager = inviteLinkManager;
        this.gateway = gateway;
        this.locks = locks;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Opens (or resumes) the session of {@code userId} for the group behind {@code linkToken}.
     *
     * @return snapshot of the live session, or null when no session was opened
     */
    public VerificationSession startSession(String userId, String linkToken) {
        VerificationLink link = linkService.resolve(linkToken);
        if (link == null) {
            log.info("User {} opened unknown verification link", userId);
            notify(userId, OutboundMessage.text(
                    "This verification link is invalid. Ask a group admin for the current link."));
            metricsConfig.recordVerificationOutcome("invalid_link");
            return null;
        }

        String groupId = link.getGroupId();
        GroupConfig config = groupConfigRepo.findByGroupId(groupId);
        if (config == null) {
            log.warn("Verification link for group {} used before the group was set up", groupId);
            notify(userId, OutboundMessage.text(
                    "This group has not been set up yet. Ask a group admin to run /setup."));
            metricsConfig.recordVerificationOutcome("not_configured");
            return null;
        }

        if (properties.isOwner(userId)) {
            log.info("Owner {} bypasses verification for group {}", userId, groupId);
            metricsConfig.recordVerificationOutcome("owner_bypass");
            deliverInvite(groupId, userId, "Owner access granted.");
            return null;
        }

        UserRecord existing = userRecordRepo.find(groupId, userId);
        if (existing != null && existing.isVerified()) {
            if (isStillMember(groupId, userId)) {
                notify(userId, OutboundMessage.text(
                        "You are already verified for this group and still a member. Nothing to do."));
            } else {
                metricsConfig.recordVerificationOutcome("reinvited");
                deliverInvite(groupId, userId, "You are already verified for this group.");
            }
            return null;
        }

        SessionKey key = new SessionKey(groupId, userId);
        List<OutboundMessage> replies = new ArrayList<>();

        VerificationSession result = locks.withLock(key.lockKey(), () -> {
            long now = clock.millis();
            VerificationSession session = liveSession(key, now, replies);
            if (session != null) {
                session.setLastActivityAt(now);
                activeGroupByUser.put(userId, groupId);
                replies.add(promptFor(session, config, now));
                log.debug("Resumed session {} in state {}", key, session.getState());
                return session.snapshot();
            }

            VerificationSession created = VerificationSession.builder()
                    .groupId(groupId)
                    .userId(userId)
                    .state(SessionState.AWAITING_ADDRESS)
                    .startedAt(now)
                    .lastActivityAt(now)
                    .build();
            sessions.put(key, created);
            activeGroupByUser.put(userId, groupId);
            replies.add(promptFor(created, config, now));
            log.info("Started verification session {}", key);
            return created.snapshot();
        });

        publishSessionCount();
        sendAll(userId, replies);
        return result;
    }

    @Observed(name = "verification.submit_address", contextualName = "check-wallet-balance")
    public VerificationSession submitAddress(String groupId, String userId, String text) {
        SessionKey key = new SessionKey(groupId, userId);
        List<OutboundMessage> replies = new ArrayList<>();
        String address = text == null ? "" : text.trim();

        // Phase 1: validate and move to CHECKING_BALANCE
        PendingCall pending = locks.withLock(key.lockKey(), () -> {
            long now = clock.millis();
            VerificationSession session = liveSession(key, now, replies);
            if (session == null) {
                if (replies.isEmpty()) replies.add(noSessionMessage());
                return null;
            }
            if (session.getState() != SessionState.AWAITING_ADDRESS) {
                replies.add(stateHint(session, now));
                return new PendingCall(session, session.snapshot(), null, false);
            }

            GroupConfig config = groupConfigRepo.findByGroupId(groupId);
            if (config == null) {
                fail(session, now, "group_removed");
                replies.add(OutboundMessage.text("This group is no longer set up for verification."));
                return new PendingCall(session, session.snapshot(), null, false);
            }

            session.setLastActivityAt(now);
            if (!AddressFormat.isValid(config.getChainId(), address)) {
                replies.add(OutboundMessage.text(
                        "That does not look like a valid wallet address. Send a 0x address with 40 hex characters."));
                return new PendingCall(session, session.snapshot(), null, false);
            }

            if (walletLinkedToOtherMember(groupId, userId, address)) {
                fail(session, now, "wallet_in_use");
                replies.add(OutboundMessage.text(
                        "This wallet is already linked to another member of the group. Each wallet can verify one member."));
                return new PendingCall(session, session.snapshot(), null, false);
            }

            session.setAddress(address);
            session.moveTo(SessionState.CHECKING_BALANCE, now);
            replies.add(OutboundMessage.text("Checking your token balance..."));
            return new PendingCall(session, session.snapshot(), config, true);
        });
        sendAll(userId, replies);
        replies.clear();

        if (pending == null || !pending.proceed()) {
            publishSessionCount();
            return pending == null ? null : pending.snapshot();
        }

        // Phase 2: chain call with no lock held
        GroupConfig config = pending.config();
        BigDecimal balance = null;
        ChainClientException failure = null;
        try {
            balance = chainClient.getBalance(config.getChainId(), config.getTokenAddress(), address);
        } catch (ChainClientException e) {
            failure = e;
        }
        BigDecimal fetched = balance;
        ChainClientException error = failure;

        // Phase 3: commit if nothing happened to the session meanwhile
        VerificationSession result = locks.withLock(key.lockKey(), () -> {
            long now = clock.millis();
            VerificationSession session = sessions.get(key);
            if (!pending.stillCurrent(session)) {
                log.debug("Dropping stale balance result for {}", key);
                return session != null ? session.snapshot() : null;
            }

            if (error != null) {
                if (error.isTransient()) {
                    log.warn("Balance check for {} failed transiently: {}", key, error.getMessage());
                    session.setAddress(null);
                    session.moveTo(SessionState.AWAITING_ADDRESS, now);
                    replies.add(OutboundMessage.text(
                            "The token balance could not be checked right now. Please try again later by sending your address again."));
                } else {
                    log.info("Balance check for {} failed permanently: {}", key, error.getMessage());
                    fail(session, now, "lookup_failed");
                    replies.add(OutboundMessage.text(
                            "Your wallet could not be looked up on chain. Verification failed."));
                }
                return session.snapshot();
            }

            if (fetched.compareTo(config.getMinBalance()) < 0) {
                log.info("Session {} failed balance check: {} < {}", key, fetched, config.getMinBalance());
                fail(session, now, "insufficient_balance");
                replies.add(OutboundMessage.text(String.format(
                        "Insufficient balance. This wallet holds %s tokens, the group requires at least %s.",
                        plain(fetched), plain(config.getMinBalance()))));
                return session.snapshot();
            }

            session.setTransferRequestedAt(now);
            session.moveTo(SessionState.AWAITING_TRANSFER, now);
            replies.add(transferInstructions(session, config));
            return session.snapshot();
        });

        publishSessionCount();
        sendAll(userId, replies);
        return result;
    }

    @Observed(name = "verification.confirm_transfer", contextualName = "confirm-proof-transfer")
    public VerificationSession confirmTransfer(String groupId, String userId) {
        SessionKey key = new SessionKey(groupId, userId);
        List<OutboundMessage> replies = new ArrayList<>();

        PendingCall pending = locks.withLock(key.lockKey(), () -> {
            long now = clock.millis();
            VerificationSession session = liveSession(key, now, replies);
            if (session == null) {
                if (replies.isEmpty()) replies.add(noSessionMessage());
                return null;
            }
            if (session.getState() != SessionState.AWAITING_TRANSFER) {
                replies.add(stateHint(session, now));
                return new PendingCall(session, session.snapshot(), null, false);
            }
            if (now < session.getNextRetryAt()) {
                long waitSeconds = (session.getNextRetryAt() - now + 999) / 1000;
                replies.add(OutboundMessage.text(
                        "Please wait " + waitSeconds + " more seconds before checking again."));
                return new PendingCall(session, session.snapshot(), null, false);
            }

            GroupConfig config = groupConfigRepo.findByGroupId(groupId);
            if (config == null) {
                fail(session, now, "group_removed");
                replies.add(OutboundMessage.text("This group is no longer set up for verification."));
                return new PendingCall(session, session.snapshot(), null, false);
            }

            session.moveTo(SessionState.CONFIRMING_TRANSFER, now);
            replies.add(OutboundMessage.text("Looking for your transfer..."));
            return new PendingCall(session, session.snapshot(), config, true);
        });
        sendAll(userId, replies);
        replies.clear();

        if (pending == null || !pending.proceed()) {
            publishSessionCount();
            return pending == null ? null : pending.snapshot();
        }

        GroupConfig config = pending.config();
        VerificationSession snapshot = pending.snapshot();
        long since = snapshot.getTransferRequestedAt()
                - TimeUnit.MINUTES.toMillis(properties.getVerification().getTransferLookbackMinutes());
        boolean found = false;
        ChainClientException failure = null;
        try {
            found = chainClient.findTransfer(config.getChainId(), config.getTokenAddress(),
                    snapshot.getAddress(), config.getVerifierAddress(),
                    properties.getVerification().getProofAmount(), Math.max(0, since));
        } catch (ChainClientException e) {
            failure = e;
        }
        boolean transferFound = found;
        ChainClientException error = failure;

        AtomicBoolean verified = new AtomicBoolean(false);
        VerificationSession result = locks.withLock(key.lockKey(), () -> {
            long now = clock.millis();
            VerificationSession session = sessions.get(key);
            if (!pending.stillCurrent(session)) {
                log.debug("Dropping stale transfer result for {}", key);
                return session != null ? session.snapshot() : null;
            }

            if (error != null) {
                if (error.isTransient()) {
                    log.warn("Transfer lookup for {} failed transiently: {}", key, error.getMessage());
                    session.moveTo(SessionState.AWAITING_TRANSFER, now);
                    replies.add(OutboundMessage.withButtons(
                            "The transfer could not be checked right now. Please try again later.",
                            MessageButton.callback("Done", DONE_CALLBACK + groupId)));
                } else {
                    log.info("Transfer lookup for {} failed permanently: {}", key, error.getMessage());
                    fail(session, now, "lookup_failed");
                    replies.add(OutboundMessage.text("Your transfer could not be looked up. Verification failed."));
                }
                return session.snapshot();
            }

            if (!transferFound) {
                session.setAttempts(session.getAttempts() + 1);
                int maxAttempts = properties.getVerification().getMaxTransferAttempts();
                if (session.getAttempts() >= maxAttempts) {
                    fail(session, now, "transfer_not_found");
                    replies.add(OutboundMessage.text(
                            "No qualifying transfer was found after " + maxAttempts + " attempts. Verification failed."));
                    return session.snapshot();
                }
                int cooldown = properties.getVerification().getRetryCooldownSeconds();
                session.setNextRetryAt(now + TimeUnit.SECONDS.toMillis(cooldown));
                session.moveTo(SessionState.AWAITING_TRANSFER, now);
                replies.add(OutboundMessage.withButtons(String.format(
                        "Transfer not found yet (attempt %d of %d). Transfers can take a minute to show up; "
                                + "tap Done again in %d seconds.", session.getAttempts(), maxAttempts, cooldown),
                        MessageButton.callback("Done", DONE_CALLBACK + groupId),
                        MessageButton.callback("Cancel", CANCEL_CALLBACK + groupId)));
                return session.snapshot();
            }

            // Re-checked right before the write: another member may have verified this wallet meanwhile
            if (walletLinkedToOtherMember(groupId, userId, session.getAddress())) {
                fail(session, now, "wallet_in_use");
                replies.add(OutboundMessage.text(
                        "This wallet is already linked to another member of the group. Each wallet can verify one member."));
                return session.snapshot();
            }

            userRecordRepo.save(UserRecord.builder()
                    .groupId(groupId)
                    .userId(userId)
                    .address(session.getAddress())
                    .verified(true)
                    .lastVerifiedAt(now)
                    .verificationTxConfirmed(true)
                    .build());
            session.moveTo(SessionState.VERIFIED, now);
            discard(session);
            metricsConfig.recordVerificationOutcome("verified");
            verified.set(true);
            log.info("User {} verified for group {} with wallet {}", userId, groupId, session.getAddress());
            return session.snapshot();
        });

        publishSessionCount();
        sendAll(userId, replies);
        if (verified.get()) {
            deliverInvite(groupId, userId, "Verification complete.");
        }
        return result;
    }

    public VerificationSession cancel(String groupId, String userId) {
        SessionKey key = new SessionKey(groupId, userId);
        List<OutboundMessage> replies = new ArrayList<>();

        VerificationSession result = locks.withLock(key.lockKey(), () -> {
            VerificationSession session = sessions.get(key);
            if (session == null) {
                replies.add(noSessionMessage());
                return null;
            }
            fail(session, clock.millis(), "cancelled");
            replies.add(OutboundMessage.text(
                    "Verification cancelled. Open the group's verification link to start again."));
            return session.snapshot();
        });

        publishSessionCount();
        sendAll(userId, replies);
        return result;
    }

    /**
     * Routes a free-text DM to the session the user touched last.
     */
    public VerificationSession handleDirectMessage(String userId, String text) {
        String groupId = activeGroupByUser.get(userId);
        VerificationSession session = groupId != null ? findSession(groupId, userId) : null;
        if (session == null) {
            notify(userId, noSessionMessage());
            return null;
        }

        String keyword = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        if (keyword.equals("cancel") || keyword.equals("/cancel")) {
            return cancel(groupId, userId);
        }

        switch (session.getState()) {
            case AWAITING_ADDRESS:
                return submitAddress(groupId, userId, text);
            case AWAITING_TRANSFER:
                if (keyword.equals("done") || keyword.equals("/done")) {
                    return confirmTransfer(groupId, userId);
                }
                notify(userId, stateHint(session, clock.millis()));
                return session;
            default:
                notify(userId, stateHint(session, clock.millis()));
                return session;
        }
    }

    /**
     * Snapshot of the live session for the key, or null.
     */
    public VerificationSession findSession(String groupId, String userId) {
        SessionKey key = new SessionKey(groupId, userId);
        return locks.withLock(key.lockKey(), () -> {
            VerificationSession session = sessions.get(key);
            return session != null ? session.snapshot() : null;
        });
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @Scheduled(fixedRateString = "${gate.verification.idle-sweep-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "60")
    public void scheduledExpiry() {
        expireIdleSessions();
    }

    public int expireIdleSessions() {
        int expired = 0;
        for (SessionKey key : new ArrayList<>(sessions.keySet())) {
            List<OutboundMessage> replies = new ArrayList<>();
            locks.runWithLock(key.lockKey(), () -> liveSession(key, clock.millis(), replies));
            if (!replies.isEmpty()) {
                expired++;
                sendAll(key.userId(), replies);
            }
        }

        publishSessionCount();
        if (expired > 0) {
            log.info("Expired {} idle verification sessions", expired);
        }
        return expired;
    }

    /**
     * Returns the live session for the key, expiring it first when idle. Caller holds the key lock.
     */
    private VerificationSession liveSession(SessionKey key, long now, List<OutboundMessage> replies) {
        VerificationSession session = sessions.get(key);
        if (session == null) return null;

        long inactivityMillis = TimeUnit.MINUTES.toMillis(properties.getVerification().getInactivityMinutes());
        if (session.isIdle(now, inactivityMillis)) {
            session.moveTo(SessionState.EXPIRED, now);
            discard(session);
            metricsConfig.recordVerificationOutcome("expired");
            log.info("Session {} expired after inactivity", key);
            replies.add(OutboundMessage.text(
                    "Your verification session expired due to inactivity. Open the verification link to start again."));
            return null;
        }
        return session;
    }

    private void fail(VerificationSession session, long now, String reason) {
        session.moveTo(SessionState.FAILED, now);
        discard(session);
        metricsConfig.recordVerificationOutcome(reason);
    }

    private void discard(VerificationSession session) {
        sessions.remove(session.key());
        activeGroupByUser.remove(session.getUserId(), session.getGroupId());
    }

    private boolean walletLinkedToOtherMember(String groupId, String userId, String address) {
        return userRecordRepo.findVerifiedByGroupId(groupId).stream()
                .anyMatch(r -> !r.getUserId().equals(userId) && AddressFormat.sameAddress(r.getAddress(), address));
    }

    private boolean isStillMember(String groupId, String userId) {
        try {
            return gateway.isGroupMember(groupId, userId);
        } catch (MessagingException e) {
            log.warn("Could not check membership of {} in group {}, issuing a fresh invite: {}",
                    userId, groupId, e.getMessage());
            return false;
        }
    }

    private void deliverInvite(String groupId, String userId, String lead) {
        try {
            InviteHandle invite = inviteLinkManager.issue(groupId, userId);
            notify(userId, OutboundMessage.withButtons(
                    lead + " Here is your one-time invite link. It works once and expires in "
                            + properties.getInvite().getTtlMinutes() + " minutes:\n" + invite.link(),
                    MessageButton.link("Join group", invite.link())));
        } catch (MessagingException e) {
            log.error("Could not create invite for user {} in group {}", userId, groupId, e);
            notify(userId, OutboundMessage.text(
                    lead + " However, no invite link could be created. Please contact a group admin."));
        }
    }

    private OutboundMessage promptFor(VerificationSession session, GroupConfig config, long now) {
        if (session.getState() == SessionState.AWAITING_ADDRESS) {
            return OutboundMessage.text(String.format(
                    "To join this group you need at least %s tokens of %s on %s.\n"
                            + "Send the wallet address that holds them.",
                    plain(config.getMinBalance()), config.getTokenAddress(), config.getChainId()));
        }
        if (session.getState() == SessionState.AWAITING_TRANSFER) {
            return transferInstructions(session, config);
        }
        return stateHint(session, now);
    }

    private OutboundMessage transferInstructions(VerificationSession session, GroupConfig config) {
        return OutboundMessage.withButtons(String.format(
                        "Balance confirmed. To prove you own %s, send exactly %s token from it to:\n%s\n"
                                + "Then tap Done.",
                        session.getAddress(), plain(properties.getVerification().getProofAmount()),
                        config.getVerifierAddress()),
                MessageButton.callback("Done", DONE_CALLBACK + session.getGroupId()),
                MessageButton.callback("Cancel", CANCEL_CALLBACK + session.getGroupId()));
    }

    private OutboundMessage stateHint(VerificationSession session, long now) {
        switch (session.getState()) {
            case AWAITING_ADDRESS:
                return OutboundMessage.text("Send the wallet address that holds your tokens.");
            case AWAITING_TRANSFER:
                if (now < session.getNextRetryAt()) {
                    return OutboundMessage.text("Send the proof transfer, then tap Done once the cooldown is over.");
                }
                return OutboundMessage.withButtons("Send the proof transfer, then tap Done.",
                        MessageButton.callback("Done", DONE_CALLBACK + session.getGroupId()),
                        MessageButton.callback("Cancel", CANCEL_CALLBACK + session.getGroupId()));
            default:
                return OutboundMessage.text("Still checking, please wait a moment.");
        }
    }

    private OutboundMessage noSessionMessage() {
        return OutboundMessage.text(
                "No verification in progress. Open your group's verification link to start.");
    }

    private void sendAll(String userId, List<OutboundMessage> replies) {
        for (OutboundMessage reply : replies) {
            notify(userId, reply);
        }
    }

    private void notify(String userId, OutboundMessage message) {
        try {
            gateway.sendDirectMessage(userId, message);
        } catch (MessagingException e) {
            log.error("Could not message user {}", userId, e);
        }
    }

    private void publishSessionCount() {
        metricsConfig.updateActiveSessionCount(sessions.size());
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private record PendingCall(VerificationSession live, VerificationSession snapshot, GroupConfig config,
                               boolean proceed) {

        // A restarted session is a new object whose revision counts from zero again
        boolean stillCurrent(VerificationSession session) {
            return session != null && session == live && session.getRevision() == snapshot.getRevision();
        }
    }
}
