package com.runway.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for command execution and session coordination.
 */
@Service
public class RunwayMetrics {

    private final MeterRegistry registry;

    public RunwayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCommandExecution(String executorKind, boolean succeeded, long ms) {
        Timer.builder("runway.command.duration")
                .tag("executor", executorKind)
                .tag("outcome", succeeded ? "ok" : "error")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records an interactive-agent run that fell back to the process result because
     * the hook delivery did not arrive in time.
     */
    public void recordHookTimeout() {
        Counter.builder("runway.hook.timeouts")
                .description("Interactive agent runs that resolved without a hook delivery")
                .register(registry)
                .increment();
    }

    /**
     * Records an inbound callback bridge delivery.
     *
     * @param matched false when no handler was registered (stale or duplicate delivery)
     */
    public void recordBridgeDelivery(boolean matched) {
        Counter.builder("runway.bridge.deliveries")
                .tag("matched", String.valueOf(matched))
                .register(registry)
                .increment();
    }

    /**
     * @param operation "next_command", "submit_result" or "post_event"
     */
    public void recordRemoteFailure(String operation) {
        Counter.builder("runway.remote.failures")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordParallelFanOut(int childCount) {
        DistributionSummary.builder("runway.parallel.children")
                .description("Number of child sessions per parallel command")
                .register(registry)
                .record(childCount);
    }
}
