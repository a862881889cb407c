package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.config.MetricsConfig;
import com.tokengate.gateway.MessageButton;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.gateway.OutboundMessage;
import com.tokengate.model.GroupConfig;
import com.tokengate.model.GroupOnboardingStatus;
import com.tokengate.model.RejectedGroup;
import com.tokengate.model.SetupStep;
import com.tokengate.model.VerificationLink;
import com.tokengate.service.OnboardingService.ApprovalOutcome;
import com.tokengate.service.OnboardingService.SetupRequestOutcome;
import com.tokengate.testutil.InMemoryStore;
import com.tokengate.testutil.MutableClock;
import com.tokengate.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.tokengate.testutil.TestDataFactory.TOKEN;
import static com.tokengate.testutil.TestDataFactory.VERIFIER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OnboardingServiceTest {

    private static final String OWNER = "1000";
    private static final String ADMIN = "500";

    @Mock private MessagingGateway gateway;
    @Mock private MetricsConfig metricsConfig;

    private InMemoryStore store;
    private MutableClock clock;
    private OnboardingService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");

        GateProperties properties = new GateProperties();
        properties.setOwnerUserId(OWNER);
        properties.setBotUsername("gatebot");

        VerificationLinkService linkService =
                new VerificationLinkService(store.verificationLinkRepository(), properties, clock);
        service = new OnboardingService(store.whitelistRepository(), store.pendingWhitelistRepository(),
                store.rejectedGroupRepository(), store.groupConfigRepository(), linkService, gateway,
                new KeyLockService(), properties, metricsConfig, clock);
    }

    private List<String> textsSentTo(String userId) {
        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(gateway, atLeastOnce()).sendDirectMessage(eq(userId), captor.capture());
        return captor.getAllValues().stream().map(OutboundMessage::text).toList();
    }

    @Test
    void requestSetup_unknownGroup_createsPendingRequestAndNotifiesOwner() {
        SetupRequestOutcome outcome = service.requestSetup("G1", "Holders", ADMIN);

        assertThat(outcome).isEqualTo(SetupRequestOutcome.PENDING_APPROVAL);
        assertThat(store.pending.get("G1").getRequestingAdminId()).isEqualTo(ADMIN);
        assertThat(store.pending.get("G1").getGroupName()).isEqualTo("Holders");

        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(gateway).sendDirectMessage(eq(OWNER), captor.capture());
        assertThat(captor.getValue().buttons())
                .extracting(MessageButton::callbackData)
                .containsExactly("approve:G1", "reject:G1");
        verify(gateway).sendGroupMessage(eq("G1"), any());
    }

    @Test
    void threeRejections_blockGroupAndRefuseFurtherRequests() {
        for (int i = 1; i <= 3; i++) {
            service.requestSetup("G2", "Spam", ADMIN);
            clock.advance(Duration.ofMinutes(1));
            RejectedGroup result = service.reject("G2", OWNER);
            assertThat(result.getRejectionCount()).isEqualTo(i);
        }

        RejectedGroup strikes = store.rejected.get("G2");
        assertThat(strikes.getRejectionCount()).isEqualTo(3);
        assertThat(strikes.isBlocked()).isTrue();
        assertThat(strikes.getFirstRejectedAt()).isLessThan(strikes.getLastRejectedAt());

        SetupRequestOutcome fourth = service.requestSetup("G2", "Spam", ADMIN);

        assertThat(fourth).isEqualTo(SetupRequestOutcome.REFUSED_BLOCKED);
        assertThat(store.pending).doesNotContainKey("G2");
        assertThat(store.rejected.get("G2").getRejectionCount()).isEqualTo(3);
        verify(metricsConfig).recordWhitelistDecision("blocked");
    }

    @Test
    void reject_withoutPendingRequest_isNoOp() {
        assertThat(service.reject("G3", OWNER)).isNull();

        assertThat(store.rejected).isEmpty();
        verifyNoInteractions(gateway);
    }

    @Test
    void reject_byNonOwner_isIgnored() {
        service.requestSetup("G1", "Holders", ADMIN);

        assertThat(service.reject("G1", "999")).isNull();
        assertThat(store.pending).containsKey("G1");
    }

    @Test
    void approve_blockedGroup_isRefused() {
        store.rejected.put("G2", TestDataFactory.createRejectedGroup("G2", 3, true));

        assertThat(service.approve("G2", OWNER)).isEqualTo(ApprovalOutcome.REFUSED_BLOCKED);
        assertThat(store.whitelist).isEmpty();
    }

    @Test
    void approve_byNonOwner_isRefused() {
        assertThat(service.approve("G1", ADMIN)).isEqualTo(ApprovalOutcome.NOT_OWNER);
        assertThat(store.whitelist).isEmpty();
    }

    @Test
    void approve_pendingRequest_whitelistsAndStartsDialog() {
        service.requestSetup("G1", "Holders", ADMIN);

        assertThat(service.approve("G1", OWNER)).isEqualTo(ApprovalOutcome.APPROVED);

        assertThat(store.whitelist.get("G1").isWhitelisted()).isTrue();
        assertThat(store.pending).isEmpty();
        assertThat(service.hasActiveDialog(ADMIN)).isTrue();
        assertThat(service.findDialog(ADMIN).getStep()).isEqualTo(SetupStep.TOKEN_ADDRESS);
        assertThat(textsSentTo(ADMIN)).anyMatch(t -> t.contains("approved"));
    }

    @Test
    void requestSetup_whitelistedGroup_startsDialogDirectly() {
        service.approve("G1", OWNER);

        assertThat(service.requestSetup("G1", "Holders", ADMIN)).isEqualTo(SetupRequestOutcome.DIALOG_STARTED);
        assertThat(store.pending).isEmpty();
        assertThat(service.hasActiveDialog(ADMIN)).isTrue();
    }

    @Test
    void requestSetup_owner_skipsWhitelist() {
        assertThat(service.requestSetup("G1", "Holders", OWNER)).isEqualTo(SetupRequestOutcome.DIALOG_STARTED);

        assertThat(store.whitelist).isEmpty();
        assertThat(store.pending).isEmpty();
        assertThat(service.hasActiveDialog(OWNER)).isTrue();
    }

    @Test
    void setupDialog_fullRun_savesConfigAndMintsLink() {
        service.requestSetup("G1", "Holders", OWNER);

        service.handleSetupInput(OWNER, "0xnotanaddress");
        assertThat(service.findDialog(OWNER).getStep()).isEqualTo(SetupStep.TOKEN_ADDRESS);

        service.handleSetupInput(OWNER, TOKEN);
        service.handleSetupInput(OWNER, "-5");
        assertThat(service.findDialog(OWNER).getStep()).isEqualTo(SetupStep.MIN_BALANCE);

        service.handleSetupInput(OWNER, "250.5");
        service.handleSetupInput(OWNER, VERIFIER);

        assertThat(service.hasActiveDialog(OWNER)).isFalse();
        GroupConfig config = store.groupConfigs.get("G1");
        assertThat(config.getTokenAddress()).isEqualTo(TOKEN);
        assertThat(config.getMinBalance()).isEqualByComparingTo(new BigDecimal("250.5"));
        assertThat(config.getVerifierAddress()).isEqualTo(VERIFIER);
        assertThat(config.getChainId()).isEqualTo("eth");
        assertThat(config.getConfiguredBy()).isEqualTo(OWNER);
        assertThat(store.links.values()).extracting(VerificationLink::getGroupId).containsExactly("G1");
        assertThat(textsSentTo(OWNER)).anyMatch(t -> t.contains("https://t.me/gatebot?start="));
    }

    @Test
    void setupDialog_configuredGroup_asksBeforeOverwriting() {
        store.groupConfigs.put("G1", TestDataFactory.createGroupConfig("G1", "100"));
        service.requestSetup("G1", "Holders", OWNER);
        assertThat(service.findDialog(OWNER).getStep()).isEqualTo(SetupStep.CONFIRM_OVERWRITE);

        service.handleSetupInput(OWNER, "no");

        assertThat(service.hasActiveDialog(OWNER)).isFalse();
        assertThat(store.groupConfigs.get("G1").getMinBalance()).isEqualByComparingTo("100");
    }

    @Test
    void setupDialog_overwriteConfirmed_continuesToTokenStep() {
        store.groupConfigs.put("G1", TestDataFactory.createGroupConfig("G1", "100"));
        service.requestSetup("G1", "Holders", OWNER);

        service.handleSetupInput(OWNER, "yes");

        assertThat(service.findDialog(OWNER).getStep()).isEqualTo(SetupStep.TOKEN_ADDRESS);
    }

    @Test
    void setupDialog_cancelKeyword_abortsWithoutSaving() {
        service.requestSetup("G1", "Holders", OWNER);
        service.handleSetupInput(OWNER, TOKEN);

        service.handleSetupInput(OWNER, "/cancel");

        assertThat(service.hasActiveDialog(OWNER)).isFalse();
        assertThat(store.groupConfigs).isEmpty();
    }

    @Test
    void setupDialog_idle_expires() {
        service.requestSetup("G1", "Holders", OWNER);
        clock.advance(Duration.ofMinutes(11));

        assertThat(service.expireIdleDialogs()).isEqualTo(1);
        assertThat(service.handleSetupInput(OWNER, TOKEN)).isFalse();
    }

    @Test
    void startDialog_adminUnreachable_tellsGroup() {
        doThrow(new MessagingException("Forbidden: bot can't initiate conversation"))
                .when(gateway).sendDirectMessage(eq(OWNER), any());

        service.requestSetup("G1", "Holders", OWNER);

        assertThat(service.hasActiveDialog(OWNER)).isFalse();
        verify(gateway).sendGroupMessage(eq("G1"), argThat(m -> m.text().contains("@gatebot")));
    }

    @Test
    void describeStatus_reflectsOnboardingStage() {
        assertThat(service.describeStatus("G1")).contains("not approved");

        service.requestSetup("G1", "Holders", ADMIN);
        assertThat(service.describeStatus("G1")).contains("waiting");

        store.rejected.put("G9", TestDataFactory.createRejectedGroup("G9", 3, true));
        assertThat(service.describeStatus("G9")).isNull();

        store.groupConfigs.put("G5", TestDataFactory.createGroupConfig("G5", "100"));
        assertThat(service.describeStatus("G5")).contains("Minimum balance: 100");
    }

    @Test
    void getGroupStatus_collectsAllOnboardingState() {
        store.rejected.put("G1", TestDataFactory.createRejectedGroup("G1", 1, false));
        store.pending.put("G1", TestDataFactory.createPendingRequest("G1", ADMIN, 5L));

        GroupOnboardingStatus status = service.getGroupStatus("G1");

        assertThat(status.isWhitelisted()).isFalse();
        assertThat(status.isBlocked()).isFalse();
        assertThat(status.getRejection().getRejectionCount()).isEqualTo(1);
        assertThat(status.getPendingRequest().getRequestingAdminId()).isEqualTo(ADMIN);
        assertThat(status.getConfig()).isNull();
        assertThat(status.getVerificationLink()).isNull();
    }
}
