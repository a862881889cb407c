package com.tokengate.controller;

import com.tokengate.model.GroupOnboardingStatus;
import com.tokengate.service.OnboardingService;
import com.tokengate.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OnboardingController.class)
class OnboardingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OnboardingService onboardingService;

    @Test
    void getPending_success() throws Exception {
        when(onboardingService.listPending()).thenReturn(List.of(
                TestDataFactory.createPendingRequest("-1001", "500", 1_700_000_000_000L)));

        mockMvc.perform(get("/api/v1/onboarding/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].groupId").value("-1001"))
                .andExpect(jsonPath("$[0].requestingAdminId").value("500"));
    }

    @Test
    void getRejections_success() throws Exception {
        when(onboardingService.listRejections()).thenReturn(List.of(
                TestDataFactory.createRejectedGroup("-1002", 3, true)));

        mockMvc.perform(get("/api/v1/onboarding/rejections"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].rejectionCount").value(3))
                .andExpect(jsonPath("$[0].blocked").value(true));
    }

    @Test
    void getGroup_success() throws Exception {
        when(onboardingService.getGroupStatus("-1003")).thenReturn(GroupOnboardingStatus.builder()
                .groupId("-1003")
                .whitelisted(true)
                .config(TestDataFactory.createGroupConfig("-1003", "100"))
                .verificationLink("https://t.me/gatebot?start=abc")
                .build());

        mockMvc.perform(get("/api/v1/onboarding/groups/-1003"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.whitelisted").value(true))
                .andExpect(jsonPath("$.blocked").value(false))
                .andExpect(jsonPath("$.config.minBalance").value(100))
                .andExpect(jsonPath("$.verificationLink").value("https://t.me/gatebot?start=abc"));
    }
}
