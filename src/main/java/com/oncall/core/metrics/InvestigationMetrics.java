package com.oncall.core.metrics;

import com.oncall.core.model.DeviceVerdict;
import com.oncall.core.model.InvestigationStatus;
import com.oncall.core.model.ToolErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for investigation sessions.
 */
@Service
public class InvestigationMetrics {

    private final MeterRegistry registry;

    public InvestigationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSessionResult(String objectiveStatus) {
        Counter.builder("investigator.sessions.total")
                .tag("objective", objectiveStatus)
                .register(registry)
                .increment();
    }

    public void recordSessionDuration(long ms) {
        Timer.builder("investigator.session.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordExecutionPasses(int passes) {
        DistributionSummary.builder("investigator.execution.passes")
                .register(registry)
                .record(passes);
    }

    public void recordDeviceInvestigation(InvestigationStatus status, long ms) {
        Timer.builder("investigator.device.duration")
                .tag("status", status.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordVerdict(DeviceVerdict verdict) {
        Counter.builder("investigator.assessment.verdicts")
                .tag("verdict", verdict.name())
                .register(registry)
                .increment();
    }

    public void recordForcedAcceptance() {
        Counter.builder("investigator.assessment.forced")
                .description("Sessions accepted because the retry bound was reached")
                .register(registry)
                .increment();
    }

    public void recordToolError(ToolErrorType type) {
        Counter.builder("investigator.tool.errors")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }
}
