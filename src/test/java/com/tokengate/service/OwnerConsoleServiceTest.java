package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.model.WhitelistEntry;
import com.tokengate.service.OnboardingService.ApprovalOutcome;
import com.tokengate.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OwnerConsoleServiceTest {

    private static final String OWNER = "1000";

    @Mock private OnboardingService onboardingService;

    private OwnerConsoleService console;

    @BeforeEach
    void setUp() {
        GateProperties properties = new GateProperties();
        properties.setOwnerUserId(OWNER);
        console = new OwnerConsoleService(onboardingService, properties);
    }

    @Test
    void handle_nonOwner_getsNoAnswer() {
        assertThat(console.handle("42", List.of("pending"))).isNull();
        verifyNoInteractions(onboardingService);
    }

    @Test
    void handle_noArguments_showsUsage() {
        assertThat(console.handle(OWNER, List.of())).isEqualTo(OwnerConsoleService.USAGE);
    }

    @Test
    void pending_listsRequests() {
        when(onboardingService.listPending()).thenReturn(List.of(
                TestDataFactory.createPendingRequest("G1", "500", 0L)));

        String answer = console.handle(OWNER, List.of("pending"));

        assertThat(answer).contains("G1").contains("Group G1").contains("by 500");
    }

    @Test
    void approve_delegatesToOnboarding() {
        when(onboardingService.approve("G1", OWNER)).thenReturn(ApprovalOutcome.APPROVED);

        assertThat(console.handle(OWNER, List.of("APPROVE", "G1"))).isEqualTo("Group G1 approved.");
    }

    @Test
    void approve_blockedGroup_explainsRefusal() {
        when(onboardingService.approve("G2", OWNER)).thenReturn(ApprovalOutcome.REFUSED_BLOCKED);

        assertThat(console.handle(OWNER, List.of("approve", "G2"))).contains("blocked");
    }

    @Test
    void reject_thirdTime_reportsBlock() {
        when(onboardingService.reject("G2", OWNER))
                .thenReturn(TestDataFactory.createRejectedGroup("G2", 3, true));

        assertThat(console.handle(OWNER, List.of("reject", "G2"))).contains("now blocked");
    }

    @Test
    void reject_withoutPending_saysSo() {
        when(onboardingService.reject("G3", OWNER)).thenReturn(null);

        assertThat(console.handle(OWNER, List.of("reject", "G3"))).contains("no pending request");
    }

    @Test
    void groupCommands_withoutGroupId_showUsage() {
        assertThat(console.handle(OWNER, List.of("approve"))).startsWith("Usage");
        assertThat(console.handle(OWNER, List.of("strikes"))).startsWith("Usage");
        verifyNoInteractions(onboardingService);
    }

    @Test
    void strikes_showsRejectionRecord() {
        when(onboardingService.findStrikes("G2")).thenReturn(TestDataFactory.createRejectedGroup("G2", 2, false));

        String answer = console.handle(OWNER, List.of("strikes", "G2"));

        assertThat(answer).contains("Rejections: 2 of 3").contains("Blocked: no");
    }

    @Test
    void list_showsWhitelistedGroups() {
        when(onboardingService.listWhitelisted()).thenReturn(List.of(
                WhitelistEntry.builder().groupId("G1").whitelisted(true).approvedAt(1L).build()));

        assertThat(console.handle(OWNER, List.of("list"))).contains("- G1");
    }

    @Test
    void blockedAndRejections_emptyLists() {
        when(onboardingService.listBlocked()).thenReturn(List.of());
        when(onboardingService.listRejections()).thenReturn(List.of());

        assertThat(console.handle(OWNER, List.of("blocked"))).isEqualTo("No blocked groups.");
        assertThat(console.handle(OWNER, List.of("rejections"))).isEqualTo("No rejected groups.");
    }
}
