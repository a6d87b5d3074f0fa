package com.example.purgebot.service;

import com.example.purgebot.model.CleanupRun;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.platform.ChannelMessageStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 清理心跳：超过阈值（默认 28 小时）没有完成过清理则报告 DOWN。
 * 启动时间计为第一次心跳。
 */
@Component("cleanup")
public class CleanupHealthIndicator implements HealthIndicator, CleanupListener {

    private final ChannelMessageStore store;
    private final Clock clock;
    private final Duration maxSilence;
    private volatile Instant lastHeartbeat;
    private volatile Instant lastCompletedRun;

    public CleanupHealthIndicator(ChannelMessageStore store, Clock clock,
                                  @Value("${app.health.max-silence:PT28H}") Duration maxSilence) {
        this.store = store;
        this.clock = clock;
        this.maxSilence = maxSilence;
        this.lastHeartbeat = clock.instant();
    }

    @Override
    public void onRunCompleted(CleanupRun run, PurgeConfig config) {
        if (!run.isFailed()) {
            Instant now = clock.instant();
            lastHeartbeat = now;
            lastCompletedRun = now;
        }
    }

    @Override
    public Health health() {
        Duration silence = Duration.between(lastHeartbeat, clock.instant());
        Health.Builder builder = silence.compareTo(maxSilence) > 0 ? Health.down() : Health.up();
        builder.withDetail("connected", store.isConnected())
                .withDetail("lastHeartbeat", lastHeartbeat.toString())
                .withDetail("maxSilence", maxSilence.toString());
        if (lastCompletedRun != null) {
            builder.withDetail("lastCompletedRun", lastCompletedRun.toString());
        }
        return builder.build();
    }
}
