package com.example.purgebot.service;

import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.DiscoveredItem;
import com.example.purgebot.model.PurgeConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 清理运行的 Micrometer 指标。
 */
@Component
public class CleanupMetrics implements CleanupListener {

    static final String METRIC_RUNS = "purgebot.cleanup.runs";
    static final String METRIC_PURGED = "purgebot.messages.purged";
    static final String METRIC_ERRORS = "purgebot.cleanup.errors";
    static final String METRIC_DURATION = "purgebot.cleanup.duration";
    static final String METRIC_DISCOVERED = "purgebot.discovery.items";

    private final MeterRegistry meterRegistry;
    private final Counter purgedCounter;
    private final Counter errorCounter;
    private final Counter discoveredCounter;

    public CleanupMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.purgedCounter = Counter.builder(METRIC_PURGED)
                .description("Messages deleted by live cleanup runs")
                .register(meterRegistry);
        this.errorCounter = Counter.builder(METRIC_ERRORS)
                .description("Channel and run level errors during cleanup")
                .register(meterRegistry);
        this.discoveredCounter = Counter.builder(METRIC_DISCOVERED)
                .description("Categories and channels added by auto-discovery")
                .register(meterRegistry);
    }

    @Override
    public void onRunCompleted(CleanupRun run, PurgeConfig config) {
        String mode = run.dryRun() ? "dry-run" : "live";
        meterRegistry.counter(METRIC_RUNS,
                "trigger", run.trigger().label(),
                "mode", mode,
                "outcome", run.outcome().name().toLowerCase(Locale.ROOT)).increment();
        Timer.builder(METRIC_DURATION)
                .description("Wall clock duration of cleanup runs")
                .tag("mode", mode)
                .register(meterRegistry)
                .record(Duration.ofMillis(run.duration()));
        if (!run.dryRun()) {
            purgedCounter.increment(run.totalPurged());
        }
        errorCounter.increment(run.totalErrors());
    }

    @Override
    public void onDiscovery(List<DiscoveredItem> discoveries, PurgeConfig config) {
        discoveredCounter.increment(discoveries.size());
    }
}
