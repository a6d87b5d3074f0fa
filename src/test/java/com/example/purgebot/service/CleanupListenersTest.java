package com.example.purgebot.service;

import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.DiscoveredItem;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.RunTrigger;
import com.example.purgebot.support.InMemoryMessageStore;
import com.example.purgebot.support.MutableClock;
import com.example.purgebot.support.RecordingListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.example.purgebot.support.TestConfigs.config;
import static org.junit.jupiter.api.Assertions.*;

class CleanupListenersTest {

    private static final Instant NOW = Instant.parse("2026-01-15T02:00:00Z");

    private static CleanupRun liveRun(int purged, int errors) {
        return new CleanupRun(NOW, RunTrigger.SCHEDULE, false, false, null, 3, purged, 0, errors, 2500, Map.of());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        RecordingListener recorder = new RecordingListener();
        CleanupListener broken = new CleanupListener() {
            @Override
            public void onRunCompleted(CleanupRun run, PurgeConfig config) {
                throw new IllegalStateException("webhook down");
            }
        };
        CleanupListeners listeners = new CleanupListeners(List.of(broken, recorder));

        assertDoesNotThrow(() -> listeners.runCompleted(liveRun(1, 0), config(7)));
        listeners.discovered(List.of(DiscoveredItem.category("Projects", List.of("a"))), config(7));

        assertEquals(1, recorder.runs.size());
        assertEquals(1, recorder.discoveries.size());
    }

    @Test
    void testMetricsCountLiveDeletesOnly() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CleanupMetrics metrics = new CleanupMetrics(registry);

        metrics.onRunCompleted(liveRun(10, 1), config(7));
        metrics.onRunCompleted(new CleanupRun(NOW, RunTrigger.API, true, false, null, 3, 99, 0, 0, 100, Map.of()),
                config(7));
        metrics.onDiscovery(List.of(DiscoveredItem.category("Projects", List.of("a"))), config(7));

        assertEquals(10.0, registry.get(CleanupMetrics.METRIC_PURGED).counter().count());
        assertEquals(1.0, registry.get(CleanupMetrics.METRIC_ERRORS).counter().count());
        assertEquals(1.0, registry.get(CleanupMetrics.METRIC_DISCOVERED).counter().count());
        assertEquals(1.0, registry.get(CleanupMetrics.METRIC_RUNS)
                .tag("mode", "dry-run").tag("trigger", "api").tag("outcome", "completed").counter().count());
        assertEquals(2, registry.get(CleanupMetrics.METRIC_DURATION).timers().size());
    }

    @Test
    void testHealthGoesDownAfterLongSilence() {
        MutableClock clock = new MutableClock(NOW);
        CleanupHealthIndicator health = new CleanupHealthIndicator(new InMemoryMessageStore(), clock,
                Duration.ofHours(28));

        assertEquals(Status.UP, health.health().getStatus());

        clock.advance(Duration.ofHours(29));
        assertEquals(Status.DOWN, health.health().getStatus());

        health.onRunCompleted(liveRun(0, 0), config(7));
        assertEquals(Status.UP, health.health().getStatus());
        assertNotNull(health.health().getDetails().get("lastCompletedRun"));
    }

    @Test
    void testFailedRunIsNotAHeartbeat() {
        MutableClock clock = new MutableClock(NOW);
        CleanupHealthIndicator health = new CleanupHealthIndicator(new InMemoryMessageStore(), clock,
                Duration.ofHours(28));

        clock.advance(Duration.ofHours(30));
        health.onRunCompleted(CleanupRun.failed(clock.instant(), RunTrigger.SCHEDULE, false, "offline", 0),
                config(7));

        assertEquals(Status.DOWN, health.health().getStatus());
    }
}
