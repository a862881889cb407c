package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.config.MetricsConfig;
import com.tokengate.gateway.InviteHandle;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.model.InviteRecord;
import com.tokengate.model.SessionKey;
import com.tokengate.repository.InviteRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Issues single-use invite links bound to one (group, user) verification event and keeps at most
 * one of them outstanding per key. Transport calls happen outside the member lock; only the
 * record swap is done under it.
 */
@Service
public class InviteLinkManager {

    private static final Logger log = LoggerFactory.getLogger(InviteLinkManager.class);

    private final InviteRepository inviteRepo;
    private final MessagingGateway gateway;
    private final KeyLockService locks;
    private final GateProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public InviteLinkManager(InviteRepository inviteRepo,
                             MessagingGateway gateway,
                             KeyLockService locks,
                             GateProperties properties,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.inviteRepo = inviteRepo;
        this.gateway = gateway;
        this.locks = locks;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Creates a new one-time invite and revokes the key's previous one, if any.
     *
     * @throws MessagingException when the transport cannot create the invite
     */
    @Observed(name = "invite.issue", contextualName = "issue-one-time-invite")
    public InviteHandle issue(String groupId, String userId) {
        long now = clock.millis();
        long expiresAt = now + TimeUnit.MINUTES.toMillis(properties.getInvite().getTtlMinutes());

        InviteHandle handle = gateway.createOneTimeInvite(groupId, "Verified " + userId, expiresAt);

        InviteRecord issued = InviteRecord.builder()
                .groupId(groupId)
                .userId(userId)
                .inviteLink(handle.link())
                .issuedAt(now)
                .expiresAt(expiresAt)
                .build();

        InviteRecord previous = locks.withLock(new SessionKey(groupId, userId).lockKey(), () -> {
            InviteRecord existing = inviteRepo.find(groupId, userId);
            inviteRepo.save(issued);
            return existing;
        });

        if (previous != null && !previous.getInviteLink().equals(handle.link())) {
            revoke(previous, "superseded");
        }

        metricsConfig.recordInvite("issued");
        log.info("Issued one-time invite for user {} in group {}, expires at {}", userId, groupId, expiresAt);
        return handle;
    }

    /**
     * Called when the user joined the group: their outstanding invite is revoked and forgotten.
     */
    public void onMemberJoined(String groupId, String userId) {
        InviteRecord consumed = forget(groupId, userId);
        if (consumed != null) {
            revoke(consumed, "consumed");
        }
    }

    /**
     * Revokes the user's outstanding invite without waiting for it to expire.
     */
    public void invalidate(String groupId, String userId) {
        InviteRecord outstanding = forget(groupId, userId);
        if (outstanding != null) {
            revoke(outstanding, "invalidated");
        }
    }

    @Scheduled(fixedRateString = "${gate.invite.purge-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "60")
    public void scheduledPurge() {
        purgeExpired();
    }

    public int purgeExpired() {
        long now = clock.millis();
        List<InviteRecord> expired = inviteRepo.findExpired(now);
        int purged = 0;

        for (InviteRecord candidate : expired) {
            InviteRecord removed = locks.withLock(
                    new SessionKey(candidate.getGroupId(), candidate.getUserId()).lockKey(), () -> {
                        InviteRecord current = inviteRepo.find(candidate.getGroupId(), candidate.getUserId());
                        // A fresher invite may have replaced the one the scan saw
                        if (current == null || !current.isExpired(now)) return null;
                        inviteRepo.delete(current.getGroupId(), current.getUserId());
                        return current;
                    });
            if (removed != null) {
                revoke(removed, "expired");
                purged++;
            }
        }

        if (purged > 0) {
            log.info("Purged {} expired invites", purged);
        }
        return purged;
    }

    private InviteRecord forget(String groupId, String userId) {
        return locks.withLock(new SessionKey(groupId, userId).lockKey(), () -> {
            InviteRecord existing = inviteRepo.find(groupId, userId);
            if (existing != null) {
                inviteRepo.delete(groupId, userId);
            }
            return existing;
        });
    }

    private void revoke(InviteRecord invite, String reason) {
        try {
            gateway.revokeInvite(invite.getGroupId(), invite.getInviteLink());
            metricsConfig.recordInvite(reason);
            log.debug("Revoked invite of user {} in group {} ({})", invite.getUserId(), invite.getGroupId(), reason);
        } catch (MessagingException e) {
            // Expired or used links can no longer be revoked; the record is gone either way
            log.warn("Could not revoke invite of user {} in group {} ({}): {}",
                    invite.getUserId(), invite.getGroupId(), reason, e.getMessage());
        }
    }
}
