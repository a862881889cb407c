package com.tokengate.config;

import com.tokengate.model.SweepReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeSessionCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeSessionCount = registry.gauge("verification.sessions.active", new AtomicInteger(0));
    }

    public void recordVerificationOutcome(String outcome) {
        Counter.builder("verification.outcome.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordChainFailure(String operation, String kind) {
        Counter.builder("chain.call.failure.count")
                .tag("operation", operation)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordWhitelistDecision(String decision) {
        Counter.builder("onboarding.decision.count")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordInvite(String event) {
        Counter.builder("invite.event.count")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public void recordJoinEnforcement(String result) {
        Counter.builder("join.enforcement.count")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordSweep(SweepReport report) {
        Timer.builder("reverification.sweep.duration")
                .tag("trigger", report.getTrigger().name())
                .register(registry)
                .record(Duration.ofMillis(Math.max(0, report.getFinishedAt() - report.getStartedAt())));

        Counter.builder("reverification.evicted.count")
                .register(registry)
                .increment(report.getEvicted());

        Counter.builder("reverification.error.count")
                .register(registry)
                .increment(report.getErrors());
    }

    public void updateActiveSessionCount(int count) {
        activeSessionCount.set(count);
    }
}
