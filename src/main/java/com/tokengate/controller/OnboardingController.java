package com.tokengate.controller;

import com.tokengate.model.GroupOnboardingStatus;
import com.tokengate.model.PendingWhitelistRequest;
import com.tokengate.model.RejectedGroup;
import com.tokengate.service.OnboardingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/onboarding")
@Tag(name = "Onboarding", description = "Group whitelist requests, strikes and setup state (read-only)")
public class OnboardingController {

    private final OnboardingService onboardingService;

    public OnboardingController(OnboardingService onboardingService) {
        this.onboardingService = onboardingService;
    }

    @GetMapping("/pending")
    @Operation(summary = "Whitelist requests waiting for the owner", description = "Oldest first")
    public ResponseEntity<List<PendingWhitelistRequest>> getPending() {
        return ResponseEntity.ok(onboardingService.listPending());
    }

    @GetMapping("/rejections")
    @Operation(summary = "Groups with at least one rejection", description = "Most recently rejected first")
    public ResponseEntity<List<RejectedGroup>> getRejections() {
        return ResponseEntity.ok(onboardingService.listRejections());
    }

    @GetMapping("/groups/{groupId}")
    @Operation(summary = "Onboarding state of one group",
               description = "Whitelist flag, pending request, strike record, configuration and current verification link")
    public ResponseEntity<GroupOnboardingStatus> getGroup(@PathVariable String groupId) {
        return ResponseEntity.ok(onboardingService.getGroupStatus(groupId));
    }
}
