package com.tokengate.controller;

import com.tokengate.model.SweepReport;
import com.tokengate.service.ReverificationScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reverification")
@Tag(name = "Re-verification", description = "Periodic balance re-checks of verified members")
public class ReverificationController {

    private final ReverificationScheduler scheduler;

    public ReverificationController(ReverificationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping("/run")
    @Operation(summary = "Run a re-verification sweep now",
               description = "Entry point for an external cron. Returns 409 with a skipped report when a sweep is already running.")
    public ResponseEntity<SweepReport> runSweep() {
        SweepReport report = scheduler.runSweepOnce(SweepReport.Trigger.MANUAL);
        if (report.isSkipped()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(report);
        }
        return ResponseEntity.ok(report);
    }

    @GetMapping("/last")
    @Operation(summary = "Report of the last completed sweep")
    public ResponseEntity<SweepReport> getLastReport() {
        SweepReport report = scheduler.getLastReport();
        if (report == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(report);
    }
}
