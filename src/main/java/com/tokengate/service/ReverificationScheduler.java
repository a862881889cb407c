package com.tokengate.service;

import com.aerospike.client.AerospikeException;
import com.tokengate.chain.ChainClient;
import com.tokengate.chain.ChainClientException;
import com.tokengate.config.GateProperties;
import com.tokengate.config.MetricsConfig;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.gateway.OutboundMessage;
import com.tokengate.model.GroupConfig;
import com.tokengate.model.SessionKey;
import com.tokengate.model.SweepReport;
import com.tokengate.model.UserRecord;
import com.tokengate.repository.GroupConfigRepository;
import com.tokengate.repository.UserRecordRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically re-checks every verified member of every configured group and removes members
 * whose balance fell below the group minimum.
 *
 * Balances are fetched without holding any lock. The keep/evict decision is then committed under
 * the member's lock, and only if the record still describes the verification the balance was
 * fetched for. An ineligible record is marked for eviction and deleted only after the member was
 * removed from the group, so a failed removal is retried by the next sweep. A sweep derives
 * everything from the store and the chain, so re-running it is safe.
 */
@Service
public class ReverificationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReverificationScheduler.class);

    private enum Decision { RETAINED, EVICTED, STALE }

    private final GroupConfigRepository groupConfigRepo;
    private final UserRecordRepository userRecordRepo;
    private final ChainClient chainClient;
    private final MessagingGateway gateway;
    private final InviteLinkManager inviteLinkManager;
    private final VerificationLinkService linkService;
    private final KeyLockService locks;
    private final GateProperties properties;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<SweepReport> lastReport = new AtomicReference<>();

    public ReverificationScheduler(GroupConfigRepository groupConfigRepo,
                                   UserRecordRepository userRecordRepo,
                                   ChainClient chainClient,
                                   MessagingGateway gateway,
                                   InviteLinkManager inviteLinkManager,
                                   VerificationLinkService linkService,
                                   KeyLockService locks,
                                   GateProperties properties,
                                   MetricsConfig metricsConfig,
                                   Tracer tracer,
                                   Clock clock) {
        this.groupConfigRepo = groupConfigRepo;
        this.userRecordRepo = userRecordRepo;
        this.chainClient = chainClient;
        this.gateway = gateway;
        this.inviteLinkManager = inviteLinkManager;
        this.linkService = linkService;
        this.locks = locks;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${gate.reverification.interval-minutes:360}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${gate.reverification.initial-delay-minutes:5}")
    public void scheduledSweep() {
        if (!properties.getReverification().isEnabled()) {
            return;
        }
        runSweepOnce(SweepReport.Trigger.SCHEDULED);
    }

    /**
     * Runs one full sweep. When another sweep is already running, returns immediately with a
     * report flagged as skipped.
     */
    @Observed(name = "reverification.sweep", contextualName = "reverification-sweep")
    public SweepReport runSweepOnce(SweepReport.Trigger trigger) {
        long startedAt = clock.millis();
        if (!running.compareAndSet(false, true)) {
            log.warn("Re-verification sweep ({}) skipped: another sweep is in progress", trigger);
            return SweepReport.builder()
                    .trigger(trigger)
                    .startedAt(startedAt)
                    .finishedAt(startedAt)
                    .skipped(true)
                    .build();
        }

        try {
            log.info("Re-verification sweep ({}) started", trigger);
            Tally tally = new Tally();

            for (GroupConfig config : groupConfigRepo.findAll()) {
                tally.groupsScanned++;
                Span groupSpan = tracer.nextSpan()
                        .name("reverification.group")
                        .tag("group.id", config.getGroupId())
                        .start();

                try (Tracer.SpanInScope ws = tracer.withSpan(groupSpan)) {
                    int evictedBefore = tally.evicted;
                    for (UserRecord pending : userRecordRepo.findPendingEvictionByGroupId(config.getGroupId())) {
                        log.info("Retrying removal of user {} from group {}", pending.getUserId(), config.getGroupId());
                        completeEviction(config.getGroupId(), pending.getUserId(), tally);
                    }
                    List<UserRecord> members = userRecordRepo.findVerifiedByGroupId(config.getGroupId());
                    for (UserRecord member : members) {
                        if (properties.isOwner(member.getUserId())) continue;
                        tally.usersChecked++;
                        checkMember(config, member, tally);
                    }
                    groupSpan.tag("group.members", String.valueOf(members.size()));
                    groupSpan.tag("group.evicted", String.valueOf(tally.evicted - evictedBefore));
                } catch (AerospikeException e) {
                    groupSpan.error(e);
                    log.warn("Could not re-verify members of group {}: {}", config.getGroupId(), e.getMessage());
                    tally.errors++;
                } finally {
                    groupSpan.end();
                }
            }

            SweepReport report = SweepReport.builder()
                    .trigger(trigger)
                    .startedAt(startedAt)
                    .finishedAt(clock.millis())
                    .groupsScanned(tally.groupsScanned)
                    .usersChecked(tally.usersChecked)
                    .retained(tally.retained)
                    .evicted(tally.evicted)
                    .skippedStale(tally.skippedStale)
                    .errors(tally.errors)
                    .build();

            lastReport.set(report);
            metricsConfig.recordSweep(report);
            log.info("Re-verification sweep ({}) complete: groups={}, checked={}, retained={}, evicted={}, stale={}, errors={}",
                    trigger, report.getGroupsScanned(), report.getUsersChecked(), report.getRetained(),
                    report.getEvicted(), report.getSkippedStale(), report.getErrors());
            return report;
        } finally {
            running.set(false);
        }
    }

    public SweepReport getLastReport() {
        return lastReport.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void checkMember(GroupConfig config, UserRecord snapshot, Tally tally) {
        String groupId = config.getGroupId();
        String userId = snapshot.getUserId();

        BigDecimal balance;
        try {
            balance = chainClient.getBalance(config.getChainId(), config.getTokenAddress(), snapshot.getAddress());
        } catch (ChainClientException e) {
            log.warn("Balance check for user {} in group {} failed ({}): {}",
                    userId, groupId, e.getKind(), e.getMessage());
            tally.errors++;
            return;
        }
        boolean eligible = balance.compareTo(config.getMinBalance()) >= 0;

        Decision decision;
        try {
            decision = locks.withLock(new SessionKey(groupId, userId).lockKey(), () -> {
                UserRecord current = userRecordRepo.find(groupId, userId);
                if (!snapshot.sameVerificationAs(current)) {
                    return Decision.STALE;
                }
                if (eligible) {
                    userRecordRepo.save(current.toBuilder().lastVerifiedAt(clock.millis()).build());
                    return Decision.RETAINED;
                }
                userRecordRepo.save(current.toBuilder().verified(false).evictionPending(true).build());
                return Decision.EVICTED;
            });
        } catch (AerospikeException e) {
            log.warn("Could not commit re-verification of user {} in group {}: {}", userId, groupId, e.getMessage());
            tally.errors++;
            return;
        }

        switch (decision) {
            case STALE:
                log.debug("User {} in group {} changed during the balance check, skipping", userId, groupId);
                tally.skippedStale++;
                break;
            case RETAINED:
                tally.retained++;
                break;
            case EVICTED:
                log.info("Evicting user {} from group {}: balance {} below minimum {}",
                        userId, groupId, balance, config.getMinBalance());
                notifyEviction(config, userId, balance);
                completeEviction(groupId, userId, tally);
                break;
        }
    }

    private void notifyEviction(GroupConfig config, String userId, BigDecimal balance) {
        String groupId = config.getGroupId();
        String link = linkService.currentDeepLink(groupId);
        String text = String.format(
                "Your wallet now holds %s tokens, below the group minimum of %s, so you have been removed from the group.",
                balance.stripTrailingZeros().toPlainString(), config.getMinBalance().stripTrailingZeros().toPlainString());
        if (link != null) {
            text += "\nYou can verify again once you meet the requirement: " + link;
        }

        try {
            gateway.sendDirectMessage(userId, OutboundMessage.text(text));
        } catch (MessagingException e) {
            log.warn("Could not notify user {} of removal from group {}: {}", userId, groupId, e.getMessage());
        }
    }

    /**
     * Revokes the member's invite and removes them from the group, holding the member's lock so a
     * verification cannot complete in between. The record is deleted only once removal succeeded;
     * otherwise it stays marked and the next sweep retries.
     */
    private void completeEviction(String groupId, String userId, Tally tally) {
        try {
            locks.runWithLock(new SessionKey(groupId, userId).lockKey(), () -> {
                UserRecord current = userRecordRepo.find(groupId, userId);
                if (current == null || !current.isEvictionPending()) {
                    log.debug("User {} in group {} re-verified before removal, keeping them", userId, groupId);
                    tally.skippedStale++;
                    return;
                }

                inviteLinkManager.invalidate(groupId, userId);
                try {
                    gateway.removeMember(groupId, userId);
                } catch (MessagingException e) {
                    log.error("Could not remove user {} from group {}, will retry on the next sweep",
                            userId, groupId, e);
                    tally.errors++;
                    return;
                }
                userRecordRepo.delete(groupId, userId);
                tally.evicted++;
            });
        } catch (AerospikeException e) {
            log.warn("Could not complete eviction of user {} in group {}: {}", userId, groupId, e.getMessage());
            tally.errors++;
        }
    }

    private static final class Tally {
        private int groupsScanned;
        private int usersChecked;
        private int retained;
        private int evicted;
        private int skippedStale;
        private int errors;
    }
}
