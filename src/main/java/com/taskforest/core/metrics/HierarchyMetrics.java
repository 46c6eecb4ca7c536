package com.taskforest.core.metrics;

import com.taskforest.core.model.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for hierarchy reconstruction.
 */
@Service
public class HierarchyMetrics {

    private final MeterRegistry registry;

    public HierarchyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPassDuration(String scope, long ms) {
        Timer.builder("taskforest.pass.duration")
                .tag("scope", scope)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param source "persisted" or "matched"
     */
    public void recordEdgeAccepted(String source) {
        Counter.builder("taskforest.edges.accepted")
                .description("Parent edges accepted after validation")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordEdgeRejected(RejectionReason reason) {
        Counter.builder("taskforest.edges.rejected")
                .description("Parent edges rejected by validation, one increment per failing rule")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordOrphans(int count) {
        DistributionSummary.builder("taskforest.orphans")
                .description("Tasks left without a parent per pass")
                .register(registry)
                .record(count);
    }

    public void recordIndexSize(int distinctPrefixes) {
        DistributionSummary.builder("taskforest.index.size")
                .description("Distinct declared-instruction prefixes per pass")
                .register(registry)
                .record(distinctPrefixes);
    }

    public void incrementMalformed() {
        Counter.builder("taskforest.skeletons.malformed")
                .description("Input skeletons that violated the loader contract")
                .register(registry)
                .increment();
    }
}
